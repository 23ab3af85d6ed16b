package io.intellixity.sqlforge.spi;

import io.intellixity.sqlforge.node.Node;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class DiscoveredDialectRegistryTest {
  public static final class AlphaProvider implements DialectProvider {
    @Override public Collection<Dialect> dialects() { return List.of(dialect("alpha")); }
  }

  public static final class BetaProvider implements DialectProvider {
    @Override public Collection<Dialect> dialects() { return List.of(dialect("beta")); }
  }

  private static Dialect dialect(String id) {
    DialectDescriptor descriptor = new DialectDescriptor(id, "\"", PlaceholderStyle.QUESTION_MARK, Set.of());
    return new Dialect() {
      @Override public DialectDescriptor descriptor() { return descriptor; }
      @Override public CompiledQuery compile(Node root) { throw new UnsupportedOperationException(); }
    };
  }

  @Test
  void looksUpCaseInsensitively() {
    Dialect a = dialect("alpha");
    DiscoveredDialectRegistry r = new DiscoveredDialectRegistry(List.of(() -> List.of(a), () -> List.of(dialect("beta"))));

    assertSame(a, r.get("ALPHA"));
    assertSame(a, r.get(" alpha "));
    assertEquals(List.of("alpha", "beta"), List.copyOf(r.ids()));
    assertTrue(r.find("gamma").isEmpty());
    assertTrue(r.find(null).isEmpty());
  }

  @Test
  void unknownIdListsKnownOnes() {
    DiscoveredDialectRegistry r = new DiscoveredDialectRegistry(List.of(() -> List.of(dialect("alpha"))));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> r.get("oracle"));
    assertTrue(ex.getMessage().contains("oracle"));
    assertTrue(ex.getMessage().contains("alpha"));
  }

  @Test
  void duplicateIdsAreAConfigurationError() {
    assertThrows(IllegalStateException.class, () -> new DiscoveredDialectRegistry(
        List.of(() -> List.of(dialect("alpha")), () -> List.of(dialect("Alpha")))));
  }

  @Test
  void discoversListedProvidersOnceInDeclaredOrder() {
    List<DialectProvider> providers = DiscoveredDialectRegistry.discoverProviders(getClass().getClassLoader());
    assertEquals(2, providers.size());
    assertInstanceOf(AlphaProvider.class, providers.get(0));
    assertInstanceOf(BetaProvider.class, providers.get(1));

    assertEquals(List.of("alpha", "beta"), List.copyOf(new DiscoveredDialectRegistry().ids()));
  }

  @Test
  void unlistedProviderKeysAreIgnored() {
    DiscoveredDialectRegistry r = new DiscoveredDialectRegistry(getClass().getClassLoader());
    assertTrue(r.find("runnable").isEmpty());
  }

  @Test
  void missingProviderClassFailsLoudly(@TempDir Path dir) throws IOException {
    Path factories = dir.resolve(DiscoveredDialectRegistry.FACTORIES_RESOURCE);
    Files.createDirectories(factories.getParent());
    Files.writeString(factories, DialectProvider.class.getName() + "=io.intellixity.sqlforge.spi.NoSuchProvider\n");

    try (URLClassLoader cl = new URLClassLoader(new URL[] {dir.toUri().toURL()}, getClass().getClassLoader())) {
      IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new DiscoveredDialectRegistry(cl));
      assertTrue(ex.getMessage().contains("NoSuchProvider"));
    }
  }

  @Test
  void listedClassMustImplementDialectProvider(@TempDir Path dir) throws IOException {
    Path factories = dir.resolve(DiscoveredDialectRegistry.FACTORIES_RESOURCE);
    Files.createDirectories(factories.getParent());
    Files.writeString(factories, DialectProvider.class.getName() + "=java.lang.Object\n");

    try (URLClassLoader cl = new URLClassLoader(new URL[] {dir.toUri().toURL()}, getClass().getClassLoader())) {
      IllegalStateException ex = assertThrows(IllegalStateException.class, () -> new DiscoveredDialectRegistry(cl));
      assertTrue(ex.getMessage().contains("java.lang.Object"));
    }
  }
}
