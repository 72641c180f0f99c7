package com.onthegomap.tilestate.tile;

import static com.onthegomap.tilestate.TestUtils.newCoordinateList;
import static com.onthegomap.tilestate.TestUtils.rectangleCoordList;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.onthegomap.tilestate.config.Arguments;
import com.onthegomap.tilestate.config.TileStateConfig;
import com.onthegomap.tilestate.geo.FlatMercatorTransform;
import com.onthegomap.tilestate.geo.GeoUtils;
import com.onthegomap.tilestate.geo.MapTransform;
import com.onthegomap.tilestate.geo.OverscaledTileId;
import com.onthegomap.tilestate.geo.Terrain;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;

class VectorTileStrategyTest {

  private static final Duration FADE = Duration.ofMillis(300);
  private final VectorTileStrategy strategy = new VectorTileStrategy();
  private final Map<OverscaledTileId, Tile> tiles = new LinkedHashMap<>();

  private Tile addTile(OverscaledTileId id, boolean hasSymbols, double queryPadding) {
    Tile tile = new Tile(id, 512).setData(TileData.ofRaw(new byte[]{1}), hasSymbols, queryPadding);
    tiles.put(id, tile);
    return tile;
  }

  private Tile addTile(OverscaledTileId id, boolean hasSymbols) {
    return addTile(id, hasSymbols, 0);
  }

  @Nested
  class FadeHold {

    private final OverscaledTileId symbols = OverscaledTileId.of(1, 0, 0);
    private final OverscaledTileId noSymbols = OverscaledTileId.of(1, 1, 0);
    private final OverscaledTileId retained = OverscaledTileId.of(1, 0, 1);

    @Test
    void testTileWithoutSymbolsRemovedImmediately() {
      addTile(noSymbols, false);
      addTile(retained, false);
      assertEquals(List.of(noSymbols), strategy.onFinishUpdate(tiles, Set.of(retained), FADE, 1000));
    }

    @Test
    void testTileWithSymbolsHeldUntilFadeFinishes() {
      Tile tile = addTile(symbols, true);
      addTile(noSymbols, false);
      addTile(retained, true);

      assertEquals(List.of(noSymbols), strategy.onFinishUpdate(tiles, Set.of(retained), FADE, 1000));
      assertTrue(tile.holdingForSymbolFade());
      tiles.remove(noSymbols);

      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(retained), FADE, 1299));
      assertTrue(tile.holdingForSymbolFade());

      assertEquals(List.of(symbols), strategy.onFinishUpdate(tiles, Set.of(retained), FADE, 1300));
      assertFalse(tile.holdingForSymbolFade());
    }

    @Test
    void testRetainingTileClearsHold() {
      Tile tile = addTile(symbols, true);
      strategy.onFinishUpdate(tiles, Set.of(), FADE, 1000);
      assertTrue(tile.holdingForSymbolFade());

      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(symbols), FADE, 1100));
      assertFalse(tile.holdingForSymbolFade());

      // dropped again later: the fade timer restarts instead of using the old deadline
      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(), FADE, 2000));
      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(), FADE, 2299));
      assertEquals(List.of(symbols), strategy.onFinishUpdate(tiles, Set.of(), FADE, 2300));
    }

    @Test
    void testZeroFadeDurationRemovesOnNextUpdate() {
      addTile(symbols, true);
      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(), Duration.ZERO, 1000));
      assertEquals(List.of(symbols), strategy.onFinishUpdate(tiles, Set.of(), Duration.ZERO, 1000));
    }

    @Test
    void testFadeDurationFromConfig() {
      var config = TileStateConfig.from(Arguments.of("fade_duration", "1s"));
      addTile(symbols, true);
      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(), config, 1000));
      assertEquals(List.of(), strategy.onFinishUpdate(tiles, Set.of(), config, 1999));
      assertEquals(List.of(symbols), strategy.onFinishUpdate(tiles, Set.of(), config, 2000));
    }

    @Test
    void testTilesHoldingForSymbolFade() {
      addTile(symbols, true);
      addTile(noSymbols, false);
      addTile(retained, true);
      assertEquals(List.of(), strategy.getTilesHoldingForSymbolFade(tiles));
      strategy.onFinishUpdate(tiles, Set.of(retained), FADE, 0);
      assertEquals(List.of(symbols), strategy.getTilesHoldingForSymbolFade(tiles));
    }

    @Test
    void testIsTileRenderable() {
      Tile tile = addTile(symbols, true);
      assertFalse(strategy.isTileRenderable(null, false));
      assertFalse(strategy.isTileRenderable(new Tile(noSymbols, 512), false));
      assertTrue(strategy.isTileRenderable(tile, false));
      assertTrue(strategy.isTileRenderable(tile, true));

      tile.setSymbolHoldDuration(300, 0);
      assertFalse(strategy.isTileRenderable(tile, false));
      assertTrue(strategy.isTileRenderable(tile, true));
    }
  }

  @Nested
  class TilesIn {

    // z1 camera over null island: the 512px screen covers world 0.25..0.75 on both axes
    private final MapTransform transform = new FlatMercatorTransform(0, 0, 1, 512, 512, 512, true);
    private final List<Coordinate> query = rectangleCoordList(100, 100, 110, 110);

    private Envelope bounds(List<Coordinate> coords) {
      return GeoUtils.boundsOf(coords);
    }

    @Test
    void testNoTransformOrEmptyQuery() {
      addTile(OverscaledTileId.of(1, 0, 0), false);
      assertEquals(List.of(), strategy.tilesIn(tiles, query, 1, false, null, null));
      assertEquals(List.of(), strategy.tilesIn(tiles, List.of(), 1, false, transform, null));
    }

    @Test
    void testFindsTileUnderQuery() {
      for (int x = 0; x <= 1; x++) {
        for (int y = 0; y <= 1; y++) {
          addTile(OverscaledTileId.of(1, x, y), false);
        }
      }
      var results = strategy.tilesIn(tiles, query, 1, false, transform, null);
      assertEquals(1, results.size());
      TileResult result = results.get(0);
      assertEquals(OverscaledTileId.of(1, 0, 0), result.tileId());
      assertSame(tiles.get(OverscaledTileId.of(1, 0, 0)), result.tile());
      assertEquals(1, result.scale());
      assertEquals(new Envelope(5696, 5856, 5696, 5856), bounds(result.queryGeometry()));
      assertEquals(result.queryGeometry(), result.cameraQueryGeometry());
    }

    @Test
    void testCoarserTilesComeFirstAndAreScaled() {
      addTile(OverscaledTileId.of(1, 0, 0), false);
      addTile(OverscaledTileId.of(0, 0, 0), false);
      var results = strategy.tilesIn(tiles, query, 1, false, transform, null);
      assertEquals(List.of(OverscaledTileId.of(0, 0, 0), OverscaledTileId.of(1, 0, 0)),
        results.stream().map(TileResult::tileId).toList());
      assertEquals(2, results.get(0).scale());
      assertEquals(new Envelope(2848, 2928, 2848, 2928), bounds(results.get(0).queryGeometry()));
    }

    @Test
    void testQueryPaddingReachesNeighboringTile() {
      addTile(OverscaledTileId.of(1, 0, 0), false);
      // the query ends 2336 tile units west of this tile, padding is queryPadding * 8192 / 512
      Tile neighbor = addTile(OverscaledTileId.of(1, 1, 0), false, 100);
      assertEquals(List.of(OverscaledTileId.of(1, 0, 0)),
        strategy.tilesIn(tiles, query, 1, false, transform, null).stream().map(TileResult::tileId).toList());

      neighbor.setData(TileData.ofRaw(new byte[]{1}), false, 150);
      assertEquals(List.of(OverscaledTileId.of(1, 1, 0), OverscaledTileId.of(1, 0, 0)),
        strategy.tilesIn(tiles, query, 1, false, transform, null).stream().map(TileResult::tileId).toList());

      neighbor.setData(TileData.ofRaw(new byte[]{1}), false, 100);
      assertEquals(2, strategy.tilesIn(tiles, query, 1.5, false, transform, null).size());
    }

    @Test
    void testSkipsTilesHeldForFade() {
      addTile(OverscaledTileId.of(1, 0, 0), true).setSymbolHoldDuration(300, 0);
      assertEquals(List.of(), strategy.tilesIn(tiles, query, 1, false, transform, null));
    }

    @Test
    void testExtendsQueryTowardsCameraFor3DLayers() {
      for (int x = 0; x <= 1; x++) {
        for (int y = 0; y <= 1; y++) {
          addTile(OverscaledTileId.of(1, x, y), false);
        }
      }
      // the camera is over the center of the screen where all four tiles meet
      var results = strategy.tilesIn(tiles, query, 1, true, transform, null);
      assertEquals(4, results.size());
      TileResult topLeft = results.stream()
        .filter(result -> result.tileId().equals(OverscaledTileId.of(1, 0, 0)))
        .findFirst()
        .orElseThrow();
      assertEquals(new Envelope(5696, 5856, 5696, 5856), bounds(topLeft.queryGeometry()));
      assertEquals(new Envelope(5696, 8192, 5696, 8192), bounds(topLeft.cameraQueryGeometry()));
    }

    @Test
    void testUsesCameraGeometryAndTerrainFromTransform() {
      MapTransform mockTransform = mock(MapTransform.class);
      Terrain terrain = (x, y) -> 0;
      when(mockTransform.zoom()).thenReturn(0d);
      when(mockTransform.allowWorldCopies()).thenReturn(true);
      when(mockTransform.screenPointToWorld(any(), any())).thenAnswer(invocation -> {
        Coordinate point = invocation.getArgument(0);
        return new CoordinateXY(point.x / 1000, point.y / 1000);
      });
      when(mockTransform.cameraQueryGeometry(any())).thenReturn(rectangleCoordList(100, 100, 900, 900));
      addTile(OverscaledTileId.of(0, 0, 0), false);
      var queryAt100 = rectangleCoordList(100, 100, 200, 200);

      var flat = strategy.tilesIn(tiles, queryAt100, 1, false, mockTransform, terrain);
      verify(mockTransform, never()).cameraQueryGeometry(any());
      verify(mockTransform, atLeastOnce()).screenPointToWorld(any(), same(terrain));
      assertEquals(1, flat.size());

      var extruded = strategy.tilesIn(tiles, queryAt100, 1, true, mockTransform, terrain);
      verify(mockTransform).cameraQueryGeometry(queryAt100);
      Envelope camera = bounds(extruded.get(0).cameraQueryGeometry());
      assertEquals(819.2, camera.getMinX(), 1e-6);
      assertEquals(7372.8, camera.getMaxX(), 1e-6);
      assertEquals(1638.4, bounds(extruded.get(0).queryGeometry()).getMaxX(), 1e-6);
    }
  }

  @Nested
  class Antimeridian {

    // z2 camera over 180°: the screen spans world x 0.875..1.125 and y 0.375..0.625
    private final List<Coordinate> fullScreen = rectangleCoordList(0, 0, 512, 512);

    private void addRow(int wrap) {
      for (int x = 0; x < 4; x++) {
        addTile(OverscaledTileId.of(2, wrap, 2, x, 1), false);
      }
    }

    private Set<OverscaledTileId> ids(List<TileResult> results) {
      return results.stream().map(TileResult::tileId).collect(Collectors.toSet());
    }

    @Test
    void testQueryAcrossAntimeridianWithoutWorldCopies() {
      addRow(0);
      var transform = new FlatMercatorTransform(180, 0, 2, 512, 512, 512, false);
      var results = strategy.tilesIn(tiles, fullScreen, 1, false, transform, null);

      assertEquals(List.of(OverscaledTileId.of(2, 3, 1), OverscaledTileId.of(2, 0, 1)),
        results.stream().map(TileResult::tileId).toList());
      // the eastern tile is matched through its western world copy
      assertEquals(new CoordinateXY(4096, 4096), results.get(0).queryGeometry().get(0));
      assertEquals(new CoordinateXY(-4096, 4096), results.get(1).queryGeometry().get(0));
    }

    @Test
    void testSameTilesAsWithWorldCopies() {
      addRow(0);
      var noCopies = strategy.tilesIn(tiles, fullScreen, 1, false,
        new FlatMercatorTransform(180, 0, 2, 512, 512, 512, false), null);

      tiles.clear();
      addTile(OverscaledTileId.of(2, 0, 2, 3, 1), false);
      addTile(OverscaledTileId.of(2, 1, 2, 0, 1), false);
      addTile(OverscaledTileId.of(2, 0, 2, 1, 1), false);
      var withCopies = strategy.tilesIn(tiles, fullScreen, 1, false,
        new FlatMercatorTransform(180, 0, 2, 512, 512, 512, true), null);

      assertEquals(Set.of(OverscaledTileId.of(2, 3, 1), OverscaledTileId.of(2, 1, 2, 0, 1)), ids(withCopies));
      assertEquals(
        ids(withCopies).stream().map(OverscaledTileId::wrapped).collect(Collectors.toSet()),
        ids(noCopies)
      );
    }

    @Test
    void testRotatedQueryAcrossAntimeridian() {
      addRow(0);
      // single world at z2 rotated 45 degrees around the center of a 200x200 viewport over world x 0.999
      MapTransform rotated = mock(MapTransform.class);
      when(rotated.zoom()).thenReturn(2d);
      when(rotated.allowWorldCopies()).thenReturn(false);
      when(rotated.screenPointToWorld(any(), any())).thenAnswer(invocation -> {
        Coordinate point = invocation.getArgument(0);
        double dx = point.x - 100;
        double dy = point.y - 100;
        double x = 0.999 + (dx - dy) / Math.sqrt(2) / 2048;
        double y = 0.375 + (dx + dy) / Math.sqrt(2) / 2048;
        return new CoordinateXY(GeoUtils.wrapWorldX(x), y);
      });

      // the top-left and bottom-right corners both land just west of the antimeridian
      var results = strategy.tilesIn(tiles, rectangleCoordList(0, 0, 200, 200), 1, false, rotated, null);
      assertEquals(List.of(OverscaledTileId.of(2, 3, 1), OverscaledTileId.of(2, 0, 1)),
        results.stream().map(TileResult::tileId).toList());
    }

    @Test
    void testTransformBboxOnlyShiftsWrappedQueries() {
      UnaryOperator<Coordinate> wrapAround = point -> new CoordinateXY(GeoUtils.wrapWorldX(point.x), point.y);
      var crossing = newCoordinateList(0.9, 0.4, 1.1, 0.4, 1.1, 0.6, 0.9, 0.6);
      var inside = newCoordinateList(0.2, 0.4, 0.3, 0.4, 0.3, 0.6, 0.2, 0.6);

      var shifted = strategy.transformBbox(crossing, wrapAround, true);
      assertEquals(-0.1, shifted.get(0).x, 1e-9);
      assertEquals(0.1, shifted.get(1).x, 1e-9);

      var notChecked = strategy.transformBbox(crossing, wrapAround, false);
      assertEquals(0.9, notChecked.get(0).x, 1e-9);
      assertEquals(0.1, notChecked.get(1).x, 1e-9);

      assertEquals(inside, strategy.transformBbox(inside, wrapAround, true));
    }
  }
}
