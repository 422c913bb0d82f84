package com.urbancanopy.raster;

import static com.urbancanopy.TestUtils.mask;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class MorphologyTest {

  @Test
  void testDilate() {
    assertEquals(mask(
      ".....",
      ".###.",
      ".###.",
      ".###.",
      "....."
    ), Morphology.dilate3x3(mask(
      ".....",
      ".....",
      "..#..",
      ".....",
      "....."
    )));
  }

  @Test
  void testErode() {
    assertEquals(mask(
      ".....",
      ".....",
      "..#..",
      ".....",
      "....."
    ), Morphology.erode3x3(mask(
      ".....",
      ".###.",
      ".###.",
      ".###.",
      "....."
    )));
  }

  @Test
  void testCloseFillsSmallHole() {
    assertEquals(mask(
      ".......",
      ".......",
      "..###..",
      "..###..",
      "..###..",
      ".......",
      "......."
    ), Morphology.close3x3(mask(
      ".......",
      ".......",
      "..###..",
      "..#.#..",
      "..###..",
      ".......",
      "......."
    )));
  }

  @Test
  void testCloseKeepsEdgePixels() {
    Mask full = mask("###", "###");
    assertEquals(full, Morphology.close3x3(full));
    assertEquals(full, Morphology.erode3x3(full));
  }
}
