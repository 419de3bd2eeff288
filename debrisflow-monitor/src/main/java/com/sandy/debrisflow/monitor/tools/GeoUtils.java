package com.sandy.debrisflow.monitor.tools;

import com.sandy.debrisflow.monitor.exception.ValidationException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.WKTReader;
import org.locationtech.jts.io.WKTWriter;

/**
 * WKT helpers for geometries stored in WGS84 lon/lat (SRID 4326).
 * Metric distances are converted to degrees with a local equirectangular approximation,
 * which is adequate at catchment scale.
 */
public final class GeoUtils {

    public static final int WGS84_SRID = 4326;
    private static final double METERS_PER_DEGREE = 111_320.0;
    private static final GeometryFactory FACTORY = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoUtils() {
    }

    public static Geometry parse(String wkt) {
        if (wkt == null || wkt.isBlank()) {
            throw new ValidationException("Geometry WKT is empty");
        }
        try {
            Geometry g = new WKTReader(FACTORY).read(wkt);
            if (!g.isValid()) {
                g = g.buffer(0);
            }
            return g;
        } catch (ParseException e) {
            throw new ValidationException("Invalid WKT geometry: " + e.getMessage());
        }
    }

    public static String toWkt(Geometry geometry) {
        return new WKTWriter().write(geometry);
    }

    public static Point point(double lon, double lat) {
        return FACTORY.createPoint(new Coordinate(lon, lat));
    }

    public static double metersToDegrees(double meters, double latitude) {
        double cos = Math.cos(Math.toRadians(latitude));
        // use the wider of the two axes so the buffer never under-covers
        return meters / (METERS_PER_DEGREE * Math.max(cos, 0.01));
    }

    public static Geometry bufferMeters(Geometry geometry, double meters) {
        if (meters <= 0) return geometry;
        double lat = geometry.getCentroid().getY();
        return geometry.buffer(metersToDegrees(meters, lat));
    }

    /** Approximate area in square metres of a lon/lat geometry. */
    public static double areaM2(Geometry geometry) {
        double lat = geometry.getCentroid().getY();
        double cos = Math.cos(Math.toRadians(lat));
        return geometry.getArea() * METERS_PER_DEGREE * METERS_PER_DEGREE * cos;
    }

    /** Share of {@code target}'s area covered by {@code cover}, in [0,1]. */
    public static double overlapFraction(Geometry target, Geometry cover) {
        if (target.isEmpty() || !target.intersects(cover)) return 0.0;
        double targetArea = target.getArea();
        if (targetArea <= 0) {
            return 1.0;
        }
        double fraction = target.intersection(cover).getArea() / targetArea;
        return Math.max(0.0, Math.min(1.0, fraction));
    }

    public static double distanceMeters(Geometry a, Geometry b) {
        double lat = (a.getCentroid().getY() + b.getCentroid().getY()) / 2.0;
        double cos = Math.cos(Math.toRadians(lat));
        // distance in degrees, scaled by the narrower axis so it never overstates proximity
        return a.distance(b) * METERS_PER_DEGREE * Math.max(cos, 0.01);
    }
}
