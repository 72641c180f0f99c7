package com.onthegomap.tilestate.geo;

import static com.onthegomap.tilestate.TestUtils.newCoordinateList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.CoordinateXY;

class FlatMercatorTransformTest {

  private final FlatMercatorTransform transform = new FlatMercatorTransform(0, 0, 1, 512, 256, 512, true);

  @Test
  void testScreenPointToWorld() {
    assertEquals(new CoordinateXY(0.5, 0.5), transform.screenPointToWorld(new CoordinateXY(256, 128), null));
    assertEquals(new CoordinateXY(0.25, 0.375), transform.screenPointToWorld(new CoordinateXY(0, 0), null));
    assertEquals(new CoordinateXY(0.75, 0.625), transform.screenPointToWorld(new CoordinateXY(512, 256), null));
  }

  @Test
  void testTerrainDoesNotMoveTopDownView() {
    assertEquals(new CoordinateXY(0.25, 0.375), transform.screenPointToWorld(new CoordinateXY(0, 0), (x, y) -> 1000));
  }

  @Test
  void testWrapsWithoutWorldCopies() {
    var atAntimeridian = new FlatMercatorTransform(180, 0, 0, 512, 512, 512, true);
    var wrapped = new FlatMercatorTransform(180, 0, 0, 512, 512, 512, false);
    var east = new CoordinateXY(384, 256);
    assertEquals(1.25, atAntimeridian.screenPointToWorld(east, null).x);
    assertEquals(0.25, wrapped.screenPointToWorld(east, null).x);
  }

  @Test
  void testCameraQueryGeometry() {
    assertEquals(newCoordinateList(10, 20, 256, 128),
      transform.cameraQueryGeometry(List.of(new CoordinateXY(10, 20))));
    assertEquals(newCoordinateList(10, 20, 256, 20, 256, 128, 10, 128, 10, 20),
      transform.cameraQueryGeometry(newCoordinateList(10, 20, 30, 20, 30, 40, 10, 40, 10, 20)));
  }

  @Test
  void testRejectsEmptyViewport() {
    assertThrows(IllegalArgumentException.class, () -> new FlatMercatorTransform(0, 0, 0, 0, 10, 512, true));
    assertThrows(IllegalArgumentException.class, () -> new FlatMercatorTransform(0, 0, 0, 10, 10, 0, true));
  }
}
