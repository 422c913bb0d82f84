package com.urbancanopy.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class BreakpointsTest {

  private static final Breakpoints SIDEWALK = Breakpoints.parse("<=5:35,<=10:25,<=20:15,<=30:5,else:0");
  private static final Breakpoints BUILDING = Breakpoints.parse("<5:0,<=15:25,<=30:15,<=50:5,else:0");
  private static final Breakpoints SUN = Breakpoints.parse("<0.3:20,<0.6:12,else:5");

  @ParameterizedTest
  @CsvSource({
    "0,35",
    "5,35",
    "5.01,25",
    "10,25",
    "20,15",
    "30,5",
    "30.5,0",
    "1000,0",
  })
  void testSidewalk(double meters, double points) {
    assertEquals(points, SIDEWALK.apply(meters));
  }

  @ParameterizedTest
  @CsvSource({
    "0,0",
    "4.99,0",
    "5,25",
    "15,25",
    "15.5,15",
    "30,15",
    "50,5",
    "51,0",
  })
  void testBuilding(double meters, double points) {
    assertEquals(points, BUILDING.apply(meters));
  }

  @ParameterizedTest
  @CsvSource({
    "0,20",
    "0.29,20",
    "0.3,12",
    "0.59,12",
    "0.6,5",
    "1,5",
  })
  void testSun(double intensity, double points) {
    assertEquals(points, SUN.apply(intensity));
  }

  @Test
  void testMinMax() {
    assertEquals(35, SIDEWALK.maxValue());
    assertEquals(0, SIDEWALK.minValue());
    assertEquals(5, SUN.minValue());
  }

  @Test
  void testElseDefaultsToZero() {
    assertEquals(0, Breakpoints.parse("<1:3").apply(2));
  }

  @Test
  void testToStringParsesBack() {
    assertEquals(BUILDING, Breakpoints.parse(BUILDING.toString()));
  }

  @ParameterizedTest
  @ValueSource(strings = {"5:35", "<=a:1", "<=1:b", ">3:1", "<=10:1,<=5:2"})
  void testInvalid(String text) {
    assertThrows(IllegalArgumentException.class, () -> Breakpoints.parse(text));
  }
}
