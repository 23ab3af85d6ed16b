package io.intellixity.sqlforge.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Dialect registry built via discovery.
 *
 * <p>Every {@code META-INF/sqlforge.factories} resource visible to the class loader is read as a Properties file;
 * the value under the {@link DialectProvider} interface name is a comma-separated list of provider classes:</p>
 *
 * <pre>
 * io.intellixity.sqlforge.spi.DialectProvider=com.acme.OracleDialectProvider,com.acme.Db2DialectProvider
 * </pre>
 *
 * <p>A provider listed more than once is created once, at its first position. Ids are matched case-insensitively.
 * Two providers registering the same id is a configuration error.</p>
 */
public final class DiscoveredDialectRegistry {
  public static final String FACTORIES_RESOURCE = "META-INF/sqlforge.factories";

  private static final Logger log = LoggerFactory.getLogger(DiscoveredDialectRegistry.class);

  private final Map<String, Dialect> byId;

  public DiscoveredDialectRegistry() {
    this(Thread.currentThread().getContextClassLoader());
  }

  public DiscoveredDialectRegistry(ClassLoader classLoader) {
    this(discoverProviders(classLoader == null ? DiscoveredDialectRegistry.class.getClassLoader() : classLoader));
  }

  public DiscoveredDialectRegistry(List<DialectProvider> providers) {
    Map<String, Dialect> m = new LinkedHashMap<>();
    for (DialectProvider p : providers) {
      if (p == null) continue;
      Collection<Dialect> ds = p.dialects();
      if (ds == null) continue;
      for (Dialect d : ds) {
        String id = d.id();
        Dialect prev = m.putIfAbsent(id, d);
        if (prev != null) {
          throw new IllegalStateException("Duplicate dialect id '" + id + "': "
              + prev.getClass().getName() + " and " + d.getClass().getName());
        }
      }
    }
    this.byId = Collections.unmodifiableMap(m);
    log.debug("sqlforge.dialects discovered={}", byId.keySet());
  }

  public Dialect get(String id) {
    Dialect d = find(id).orElse(null);
    if (d == null) throw new IllegalArgumentException("Unknown dialect: " + id + " (known: " + byId.keySet() + ")");
    return d;
  }

  public Optional<Dialect> find(String id) {
    if (id == null) return Optional.empty();
    return Optional.ofNullable(byId.get(id.trim().toLowerCase(Locale.ROOT)));
  }

  public Set<String> ids() {
    return byId.keySet();
  }

  static List<DialectProvider> discoverProviders(ClassLoader cl) {
    Set<String> classNames = new LinkedHashSet<>();
    for (URL url : factoriesResources(cl)) {
      classNames.addAll(providerClassNames(url));
    }
    List<DialectProvider> providers = new ArrayList<>(classNames.size());
    for (String className : classNames) {
      providers.add(createProvider(className, cl));
    }
    log.debug("sqlforge.providers classes={}", classNames);
    return providers;
  }

  private static List<URL> factoriesResources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(FACTORIES_RESOURCE));
    } catch (IOException e) {
      throw new IllegalStateException("Cannot list " + FACTORIES_RESOURCE + " resources", e);
    }
  }

  private static List<String> providerClassNames(URL url) {
    Properties factories = new Properties();
    try (InputStream in = url.openStream()) {
      factories.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read " + url, e);
    }
    String listed = factories.getProperty(DialectProvider.class.getName(), "");
    List<String> names = new ArrayList<>();
    for (String name : listed.split(",")) {
      if (!name.isBlank()) names.add(name.trim());
    }
    return names;
  }

  private static DialectProvider createProvider(String className, ClassLoader cl) {
    Class<?> type;
    try {
      type = Class.forName(className, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Dialect provider " + className + " listed in " + FACTORIES_RESOURCE
          + " is not on the classpath", e);
    }
    if (!DialectProvider.class.isAssignableFrom(type)) {
      throw new IllegalStateException(className + " is listed as a dialect provider but does not implement "
          + DialectProvider.class.getName());
    }
    try {
      return (DialectProvider) type.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Cannot create dialect provider " + className, e);
    }
  }
}
