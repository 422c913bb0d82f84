package com.urbancanopy.detect;

import static com.urbancanopy.TestUtils.config;
import static com.urbancanopy.TestUtils.solidImage;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.urbancanopy.config.CanopyConfig;
import com.urbancanopy.geo.Grid;
import java.awt.image.BufferedImage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.locationtech.jts.geom.Envelope;

class FeatureDetectorTest {

  private static final Grid GRID = Grid.fromBounds(new Envelope(101.68, 101.69, 3.13, 3.14), 20, 20);
  private final FeatureDetector detector = new FeatureDetector(CanopyConfig.defaults());

  @ParameterizedTest
  @CsvSource({
    "255,0,-1",
    "0,255,1",
    "128,128,0",
    "0,0,0",
    "100,150,0.2",
  })
  void testNdvi(int red, int green, double expected) {
    assertEquals(expected, FeatureDetector.ndvi(red, green, 1e-8), 1e-6);
  }

  @Test
  void testHsv() {
    assertEquals(200, FeatureDetector.brightness(10, 200, 50));
    assertEquals(255d * 190 / 200, FeatureDetector.saturation(10, 200, 50), 1e-9);
    assertEquals(0, FeatureDetector.saturation(0, 0, 0));
    assertEquals(0, FeatureDetector.saturation(90, 90, 90));
  }

  @Test
  void testGreenIsVegetation() {
    FeatureRasters result = detector.detect(solidImage(20, 20, 0x20c020), GRID);
    assertEquals(400, result.vegetation().count());
    assertTrue(result.shadow().isEmpty());
  }

  @Test
  void testGrayIsNeither() {
    FeatureRasters result = detector.detect(solidImage(20, 20, 0x808080), GRID);
    assertTrue(result.vegetation().isEmpty());
    assertTrue(result.shadow().isEmpty());
    assertEquals(1 - 128 / 255d, result.shadowIntensity().get(5, 5), 1e-5);
  }

  @Test
  void testDarkGreenIsNotVegetation() {
    FeatureRasters result = detector.detect(solidImage(20, 20, 0x003000), GRID);
    assertTrue(result.vegetation().isEmpty());
  }

  @Test
  void testLargeShadowKeptSmallShadowRemoved() {
    BufferedImage image = solidImage(20, 20, 0xc8c8c8);
    for (int y = 5; y < 15; y++) {
      for (int x = 5; x < 15; x++) {
        image.setRGB(x, y, 0x282828);
      }
    }
    image.setRGB(0, 0, 0x101010);
    image.setRGB(1, 0, 0x101010);
    FeatureRasters result = detector.detect(image, GRID);
    assertEquals(100, result.shadow().count());
    assertTrue(result.shadow().get(10, 10));
    assertFalse(result.shadow().get(0, 0));
    assertTrue(result.shadowIntensity().get(10, 10) > result.shadowIntensity().get(19, 19));
  }

  @Test
  void testDarkDesaturatedIsShadow() {
    FeatureRasters result = new FeatureDetector(config("shadow_min_size", 1))
      .detect(solidImage(20, 20, 0x5a5a5a), GRID);
    assertEquals(400, result.shadow().count());
  }

  @Test
  void testShadowNeverOverlapsVegetation() {
    BufferedImage image = solidImage(20, 20, 0x101010);
    for (int x = 0; x < 20; x++) {
      image.setRGB(x, 10, 0x10f010);
    }
    FeatureRasters result = detector.detect(image, GRID);
    assertEquals(20, result.vegetation().count());
    assertTrue(result.shadow().and(result.vegetation()).isEmpty());
  }

  @Test
  void testIntensityInRange() {
    FeatureRasters black = detector.detect(solidImage(20, 20, 0), GRID);
    assertEquals(1, black.shadowIntensity().max(), 1e-6);
    FeatureRasters white = detector.detect(solidImage(20, 20, 0xffffff), GRID);
    assertEquals(0, white.shadowIntensity().max(), 1e-6);
  }

  @Test
  void testImageSizeMustMatchGrid() {
    var image = solidImage(10, 20, 0);
    assertThrows(IllegalArgumentException.class, () -> detector.detect(image, GRID));
  }
}
