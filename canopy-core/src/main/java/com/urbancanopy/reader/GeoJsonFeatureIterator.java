package com.urbancanopy.reader;

import static com.fasterxml.jackson.core.JsonParser.Feature.INCLUDE_SOURCE_IN_LOCATION;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.urbancanopy.geo.GeoUtils;
import com.urbancanopy.util.CloseableIterator;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incrementally parses features out of a GeoJSON document so that large inputs never need to be held in memory as a
 * tree.
 */
public class GeoJsonFeatureIterator implements CloseableIterator<VectorFeature> {
  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonFeatureIterator.class);
  private final ObjectMapper mapper = new ObjectMapper();
  private final JsonParser parser;
  private final String name;
  private VectorFeature next = null;
  private Map<String, Object> properties = null;
  private GeoJsonGeometry geometry;
  private int nestingLevel = 0;

  @JsonIgnoreProperties(ignoreUnknown = true)
  private record GeoJsonGeometry(String type, List<?> coordinates) {}

  public GeoJsonFeatureIterator(InputStream in, String name) throws IOException {
    this.name = name;
    this.parser = new JsonFactory().createParser(in);
    parser.enable(INCLUDE_SOURCE_IN_LOCATION);
    advance();
  }

  @Override
  public void close() {
    try {
      parser.close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public boolean hasNext() {
    return next != null;
  }

  @Override
  public VectorFeature next() {
    if (!hasNext()) {
      throw new NoSuchElementException();
    }
    VectorFeature item = next;
    advance();
    return item;
  }

  private void advance() {
    try {
      next = null;
      while (next == null && !parser.isClosed()) {
        if (nestingLevel == 0) {
          findNextStruct();
        }
        JsonToken token = null;
        while (nestingLevel > 0 && (token = parser.nextToken()) != null && !token.isStructEnd()) {
          if (token == JsonToken.START_OBJECT) {
            nestingLevel++;
          } else if (token == JsonToken.FIELD_NAME) {
            consumeField(parser.currentName());
          } else {
            LOGGER.warn("Unexpected token inside struct of {} at {}: {}", name, loc(), token);
          }
        }
        if (token == JsonToken.END_ARRAY) {
          nestingLevel--;
        } else if (token == JsonToken.END_OBJECT) {
          var geom = getGeometry();
          if (geom != null) {
            next = new VectorFeature(geom, properties == null ? Map.of() : properties);
          }
          geometry = null;
          properties = null;
          nestingLevel--;
        } else if (token == null) {
          nestingLevel = 0;
          parser.close();
        }
      }
    } catch (IOException e) {
      throw new FileFormatException("Invalid geojson " + name + " at " + loc(), e);
    }
  }

  private void consumeField(String field) throws IOException {
    switch (field == null ? "" : field) {
      case "geometry" -> consumeGeometry();
      case "properties" -> consumeProperties();
      case "type" -> consume(JsonToken.VALUE_STRING);
      case "features" -> {
        consume(JsonToken.START_ARRAY);
        nestingLevel++;
      }
      default -> {
        parser.nextToken();
        parser.skipChildren();
      }
    }
  }

  private void consume(JsonToken tokenType) throws IOException {
    JsonToken actual = parser.nextToken();
    if (actual != tokenType) {
      LOGGER.warn("Unexpected token type in {} at {}: expected {} got {}", name, loc(), tokenType, actual);
    }
  }

  private void findNextStruct() throws IOException {
    JsonToken token;
    while ((token = parser.nextToken()) != null && token != JsonToken.START_OBJECT) {
      LOGGER.warn("Unexpected top-level token in {} at {}: {}", name, loc(), token);
      parser.skipChildren();
    }
    if (token == null) {
      parser.close();
    } else {
      nestingLevel++;
    }
  }

  private String loc() {
    return parser.currentTokenLocation().offsetDescription();
  }

  private Geometry getGeometry() {
    if (geometry == null || geometry.type == null || geometry.coordinates == null) {
      return null;
    }
    try {
      return switch (geometry.type) {
        case "Point" -> GeoUtils.JTS_FACTORY.createPoint(coordinate(geometry.coordinates));
        case "LineString" -> lineString(geometry.coordinates);
        case "Polygon" -> polygon(geometry.coordinates);
        case "MultiPoint" -> GeoUtils.JTS_FACTORY.createMultiPoint(
          lists(geometry.coordinates).stream().map(this::coordinate).map(GeoUtils.JTS_FACTORY::createPoint)
            .toArray(Point[]::new));
        case "MultiLineString" -> GeoUtils.JTS_FACTORY.createMultiLineString(
          lists(geometry.coordinates).stream().map(this::lineString).toArray(LineString[]::new));
        case "MultiPolygon" -> GeoUtils.JTS_FACTORY.createMultiPolygon(
          lists(geometry.coordinates).stream().map(this::polygon).toArray(Polygon[]::new));
        default -> {
          LOGGER.warn("Unexpected geometry type in {}: {}", name, geometry.type);
          yield null;
        }
      };
    } catch (IllegalArgumentException | ClassCastException | IndexOutOfBoundsException e) {
      LOGGER.warn("Skipping malformed {} in {}: {}", geometry.type, name, e.toString());
      return null;
    }
  }

  private static List<List<?>> lists(List<?> list) {
    return list.stream().filter(List.class::isInstance).<List<?>>map(List.class::cast).toList();
  }

  private Polygon polygon(List<?> list) {
    List<LinearRing> rings = lists(list).stream().map(this::linearRing).toList();
    if (rings.isEmpty()) {
      return GeoUtils.JTS_FACTORY.createPolygon();
    }
    return GeoUtils.JTS_FACTORY.createPolygon(rings.get(0), rings.subList(1, rings.size()).toArray(LinearRing[]::new));
  }

  private Coordinate coordinate(List<?> list) {
    return new CoordinateXY(((Number) list.get(0)).doubleValue(), ((Number) list.get(1)).doubleValue());
  }

  private Coordinate[] coordinates(List<?> list) {
    return lists(list).stream().map(this::coordinate).toArray(Coordinate[]::new);
  }

  private LineString lineString(List<?> list) {
    return GeoUtils.JTS_FACTORY.createLineString(coordinates(list));
  }

  private LinearRing linearRing(List<?> list) {
    return GeoUtils.JTS_FACTORY.createLinearRing(coordinates(list));
  }

  @SuppressWarnings("unchecked")
  private void consumeProperties() throws IOException {
    if (parser.nextToken() == JsonToken.START_OBJECT) {
      properties = mapper.readValue(parser, Map.class);
    } else {
      parser.skipChildren();
    }
  }

  private void consumeGeometry() throws IOException {
    if (parser.nextToken() == JsonToken.START_OBJECT) {
      geometry = mapper.readValue(parser, GeoJsonGeometry.class);
    } else {
      parser.skipChildren();
    }
  }
}
