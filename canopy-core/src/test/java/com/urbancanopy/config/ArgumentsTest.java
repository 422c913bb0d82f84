package com.urbancanopy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.urbancanopy.TestUtils;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ArgumentsTest {

  @Test
  void testEmpty() {
    assertEquals("fallback", Arguments.of().getString("key", "key", "fallback"));
  }

  @Test
  void testMapBased() {
    assertEquals("value", Arguments.of(
      "key", "value"
    ).getString("key", "key", "fallback"));
  }

  @Test
  void testOrElse() {
    Arguments args = Arguments.of("key1", "value1a", "key2", "value2a")
      .orElse(Arguments.of("key2", "value2b", "key3", "value3b"));

    assertEquals("value1a", args.getString("key1", "key", "fallback"));
    assertEquals("value2a", args.getString("key2", "key", "fallback"));
    assertEquals("value3b", args.getString("key3", "key", "fallback"));
    assertEquals("fallback", args.getString("key4", "key", "fallback"));
  }

  @Test
  void testConfigFileParsing() {
    Arguments args = Arguments.fromConfigFile(TestUtils.pathToResource("test.properties"));

    assertEquals(2, args.threads());
    assertEquals(19, args.getInteger("zoom", "zoom", 18));
    assertEquals(1.5, args.getDouble("align_scale", "scale", 1.95));
    assertEquals("fallback", args.getString("key3", "key", "fallback"));
  }

  @Test
  void testGetConfigFileFromArgs() {
    Arguments args = Arguments.fromArgsOrConfigFile(
      "config=" + TestUtils.pathToResource("test.properties"),
      "zoom=17"
    );

    assertEquals(17, args.getInteger("zoom", "zoom", 18));
    assertEquals(1.5, args.getDouble("align_scale", "scale", 1.95));
    assertEquals("<=4:35,else:0", args.getString("sidewalk_breakpoints", "breakpoints", ""));
  }

  @Test
  void testMissingConfigFile() {
    assertThrows(IllegalArgumentException.class,
      () -> Arguments.fromConfigFile(Path.of("does", "not", "exist.properties")));
  }

  @Test
  void testCommandLineForms() {
    Arguments args = Arguments.fromArgs("key1=value1", "--key2", "value2", "--flag", "--other=x");
    assertEquals("value1", args.getString("key1", "key", null));
    assertEquals("value2", args.getString("key2", "key", null));
    assertEquals("true", args.getString("flag", "flag", null));
    assertEquals("x", args.getString("other", "key", null));
    assertNull(args.getString("missing", "flag", null));
  }

  @Test
  void testSeparatorAndCaseInsensitive() {
    Arguments args = Arguments.of("Shadow-Min-Size", "12");
    assertEquals(12, args.getInteger("shadow_min_size", "size", 20));
    assertEquals(12, args.getInteger("shadow.min.size", "size", 20));
  }

  @Test
  void testDeprecatedFallbackKey() {
    Arguments args = Arguments.of("old_name", "value");
    assertEquals("value", args.getString("new_name|old_name", "key", "fallback"));
  }

  @Test
  void testJvmProperties() {
    Map<String, String> props = Map.of("canopy.zoom", "16", "other.zoom", "1");
    Arguments args = Arguments.fromJvmProperties(props::get, props::keySet);
    assertEquals(16, args.getInteger("zoom", "zoom", 18));
    assertEquals("fallback", args.getString("other_zoom", "zoom", "fallback"));
  }

  @Test
  void testEnvironment() {
    Map<String, String> env = Map.of("CANOPY_ALIGN_SCALE", "2.5", "PATH", "/bin");
    Arguments args = Arguments.fromEnvironment(env::get, env::keySet);
    assertEquals(2.5, args.getDouble("align_scale", "scale", 1));
    assertNull(args.getString("path", "path", null));
  }

  @Test
  void testThreadsAtLeastOne() {
    assertEquals(1, Arguments.of("threads", "0").threads());
  }

  @Test
  void testGetObject() {
    Arguments args = Arguments.of("breakpoints", "<1:5");
    assertEquals(Breakpoints.parse("<1:5"),
      args.getObject("breakpoints", "breakpoints", Breakpoints.parse("else:0"), Breakpoints::parse));
  }
}
