package gov.nih.ncats.molgraph.internal.util;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.Collection;
import java.util.Optional;

/**
 * Small 2D helpers for layout code. Vectors are {@code double[]{dx,dy}},
 * points are {@link Point2D}.
 */
public class GeomUtil {
    public static final double EPS = 0.0001;

    private GeomUtil(){
        //can not instantiate
    }

    /**
     * Twice the signed area of the triangle (p1,p2,p3); positive when counter clockwise.
     */
    public static double ccw (Point2D p1, Point2D p2, Point2D p3) {
        return (p2.getX () - p1.getX ()) * (p3.getY () - p1.getY ())
             - (p2.getY () - p1.getY ()) * (p3.getX () - p1.getX ());
    }

    /**
     * angle of the vector from p0 to p1 in radians
     */
    public static double angle (Point2D p0, Point2D p1) {
        return Math.atan2(p1.getY() - p0.getY(), p1.getX() - p0.getX());
    }

    public static double angle (double[] v) {
        return Math.atan2(v[1], v[0]);
    }

    /**
     * Angle at b formed by a-b-c, in radians in [0,pi].
     */
    public static double angle (Point2D a, Point2D b, Point2D c) {
        double[] v1 = vector(b, a);
        double[] v2 = vector(b, c);
        double l = l2Norm(v1) * l2Norm(v2);
        if(l <= EPS){
            return 0;
        }
        double cos = Math.max(-1, Math.min(1, dot(v1, v2) / l));
        return Math.acos(cos);
    }

    public static double[] vector(Point2D from, Point2D to){
        return new double[]{to.getX() - from.getX(), to.getY() - from.getY()};
    }

    public static double l2Norm(double[] v){
        return Math.sqrt(v[0]*v[0]+v[1]*v[1]);
    }

    public static double dot(double[] a, double[] b){
        return a[0]*b[0]+a[1]*b[1];
    }

    /**
     * Unit vector in the same direction.
     * @return the unit vector or null if the vector is (nearly) zero length.
     */
    public static double[] normalize(double[] v){
        double len = l2Norm(v);
        if(len <= EPS){
            return null;
        }
        return new double[]{v[0]/len, v[1]/len};
    }

    public static double[] unitVector(double angle){
        return new double[]{Math.cos(angle), Math.sin(angle)};
    }

    public static double[] rotate(double[] v, double angle){
        double c = Math.cos(angle);
        double s = Math.sin(angle);
        return new double[]{v[0]*c - v[1]*s, v[0]*s + v[1]*c};
    }

    public static double[] negate(double[] v){
        return new double[]{-v[0], -v[1]};
    }

    /**
     * p + v*scale
     */
    public static Point2D translate(Point2D p, double[] v, double scale){
        return new Point2D.Double(p.getX() + v[0]*scale, p.getY() + v[1]*scale);
    }

    /**
     * True only for a proper crossing; touching at an end point or overlapping
     * collinear segments do not count.
     */
    public static boolean segmentsIntersect(Point2D p1, Point2D p2, Point2D p3, Point2D p4){
        double o1 = ccw(p1, p2, p3);
        double o2 = ccw(p1, p2, p4);
        double o3 = ccw(p3, p4, p1);
        double o4 = ccw(p3, p4, p2);
        return o1*o2 < 0 && o3*o4 < 0;
    }

    /**
     * Mirror image of p across the line through a and b.
     * If a and b are (nearly) the same point p is returned unchanged.
     */
    public static Point2D reflect(Point2D p, Point2D a, Point2D b){
        double vx = b.getX() - a.getX();
        double vy = b.getY() - a.getY();
        double len2 = vx*vx + vy*vy;
        if(len2 <= EPS){
            return p;
        }
        double t = ((p.getX() - a.getX())*vx + (p.getY() - a.getY())*vy)/len2;
        double px = a.getX() + t*vx;
        double py = a.getY() + t*vy;
        return new Point2D.Double(2*px - p.getX(), 2*py - p.getY());
    }

    public static double pointSegmentDistance(Point2D p, Point2D a, Point2D b){
        double vx = b.getX() - a.getX();
        double vy = b.getY() - a.getY();
        double len2 = vx*vx + vy*vy;
        if(len2 <= EPS){
            return p.distance(a);
        }
        double t = Math.max(0, Math.min(1, ((p.getX() - a.getX())*vx + (p.getY() - a.getY())*vy)/len2));
        return p.distance(a.getX() + t*vx, a.getY() + t*vy);
    }

    public static double segmentDistance(Point2D p1, Point2D p2, Point2D p3, Point2D p4){
        if(segmentsIntersect(p1, p2, p3, p4)){
            return 0;
        }
        return Math.min(
                Math.min(pointSegmentDistance(p1, p3, p4), pointSegmentDistance(p2, p3, p4)),
                Math.min(pointSegmentDistance(p3, p1, p2), pointSegmentDistance(p4, p1, p2)));
    }

    public static Optional<Point2D> findCenterOfVertices(Collection<Point2D> points){
        if(points.isEmpty()){
            return Optional.empty();
        }
        double sx = 0, sy = 0;
        for(Point2D p : points){
            sx += p.getX();
            sy += p.getY();
        }
        return Optional.of(new Point2D.Double(sx/points.size(), sy/points.size()));
    }

    /**
     * Box around the points with width and height at least {@link #EPS}.
     */
    public static Optional<Rectangle2D> boundingBox(Collection<Point2D> points){
        if(points.isEmpty()){
            return Optional.empty();
        }
        double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for(Point2D p : points){
            minX = Math.min(minX, p.getX());
            minY = Math.min(minY, p.getY());
            maxX = Math.max(maxX, p.getX());
            maxY = Math.max(maxY, p.getY());
        }
        return Optional.of(new Rectangle2D.Double(minX, minY, Math.max(EPS, maxX - minX), Math.max(EPS, maxY - minY)));
    }
}
