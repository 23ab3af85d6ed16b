package io.intellixity.sqlforge.jdbc.dialect;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlforge.spi.Dialect;
import io.intellixity.sqlforge.spi.DialectDescriptor;
import io.intellixity.sqlforge.spi.DialectProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;

/**
 * Dialects declared as data in {@code META-INF/sqlforge-dialects.json} resources:
 *
 * <pre>
 * { "dialects": [
 *   { "id": "cockroach", "identifierQuote": "\"", "placeholderStyle": "DOLLAR_NUMBERED",
 *     "features": ["RETURNING", "ON_CONFLICT", "FULL_JOIN"] }
 * ] }
 * </pre>
 *
 * Each descriptor becomes a {@link GenericSqlDialect}.
 */
public final class JsonDialectProvider implements DialectProvider {
  public static final String RESOURCE = "META-INF/sqlforge-dialects.json";

  private static final Logger log = LoggerFactory.getLogger(JsonDialectProvider.class);
  private static final ObjectMapper JSON = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

  record DialectsFile(List<DialectDescriptor> dialects) {}

  private final ClassLoader classLoader;

  public JsonDialectProvider() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public JsonDialectProvider(ClassLoader classLoader) {
    this.classLoader = classLoader == null ? JsonDialectProvider.class.getClassLoader() : classLoader;
  }

  @Override
  public Collection<Dialect> dialects() {
    List<Dialect> out = new ArrayList<>();
    Enumeration<URL> resources;
    try {
      resources = classLoader.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      for (DialectDescriptor d : read(url)) {
        log.debug("sqlforge.dialect_json id={} placeholderStyle={} features={} source={}",
            d.id(), d.placeholderStyle(), d.features(), url);
        out.add(new GenericSqlDialect(d));
      }
    }
    return out;
  }

  static List<DialectDescriptor> read(URL url) {
    try (InputStream in = url.openStream()) {
      return parse(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read dialect descriptors from " + url, e);
    }
  }

  static List<DialectDescriptor> parse(InputStream in) throws IOException {
    DialectsFile file = JSON.readValue(in, DialectsFile.class);
    return file == null || file.dialects() == null ? List.of() : file.dialects();
  }
}
