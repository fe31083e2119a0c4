package gov.nih.ncats.molgraph.internal.util;

import static org.junit.Assert.*;

import java.awt.geom.Point2D;
import java.awt.geom.Rectangle2D;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class GeomUtilTest {

    private static Point2D p(double x, double y){
        return new Point2D.Double(x, y);
    }

    @Test
    public void ccwSign(){
        assertTrue(GeomUtil.ccw(p(0,0), p(1,0), p(0,1)) > 0);
        assertTrue(GeomUtil.ccw(p(0,0), p(0,1), p(1,0)) < 0);
        assertEquals(0, GeomUtil.ccw(p(0,0), p(1,1), p(2,2)), 0.0001);
    }

    @Test
    public void angleAtVertex(){
        assertEquals(Math.PI/2, GeomUtil.angle(p(1,0), p(0,0), p(0,1)), 0.0001);
        assertEquals(Math.PI, GeomUtil.angle(p(-1,0), p(0,0), p(1,0)), 0.0001);
        assertEquals(0, GeomUtil.angle(p(0,0), p(0,0), p(1,0)), 0.0001);
    }

    @Test
    public void directionAngle(){
        assertEquals(Math.PI/4, GeomUtil.angle(p(0,0), p(2,2)), 0.0001);
        assertEquals(-Math.PI/2, GeomUtil.angle(new double[]{0,-3}), 0.0001);
    }

    @Test
    public void vectors(){
        double[] v = GeomUtil.normalize(new double[]{3,4});
        assertEquals(0.6, v[0], 0.0001);
        assertEquals(0.8, v[1], 0.0001);
        assertNull(GeomUtil.normalize(new double[]{0,0}));

        double[] r = GeomUtil.rotate(new double[]{1,0}, Math.PI/2);
        assertEquals(0, r[0], 0.0001);
        assertEquals(1, r[1], 0.0001);

        assertEquals(p(1,2), GeomUtil.translate(p(0,0), new double[]{0.5,1}, 2));
    }

    @Test
    public void crossingSegments(){
        assertTrue(GeomUtil.segmentsIntersect(p(0,0), p(2,2), p(0,2), p(2,0)));
        //shared end point is not a crossing
        assertFalse(GeomUtil.segmentsIntersect(p(0,0), p(1,1), p(1,1), p(2,0)));
        assertFalse(GeomUtil.segmentsIntersect(p(0,0), p(1,0), p(0,1), p(1,1)));
    }

    @Test
    public void distances(){
        assertEquals(1, GeomUtil.pointSegmentDistance(p(1,1), p(0,0), p(2,0)), 0.0001);
        assertEquals(Math.sqrt(2), GeomUtil.pointSegmentDistance(p(3,1), p(0,0), p(2,0)), 0.0001);
        assertEquals(0, GeomUtil.segmentDistance(p(0,0), p(2,2), p(0,2), p(2,0)), 0.0001);
        assertEquals(1, GeomUtil.segmentDistance(p(0,0), p(1,0), p(0,1), p(1,1)), 0.0001);
    }

    @Test
    public void reflectAcrossLine(){
        Point2D r = GeomUtil.reflect(p(1,1), p(0,0), p(1,0));
        assertEquals(1, r.getX(), 0.0001);
        assertEquals(-1, r.getY(), 0.0001);
    }

    @Test
    public void centerAndBox(){
        assertEquals(p(1,1), GeomUtil.findCenterOfVertices(Arrays.asList(p(0,0), p(2,2), p(0,2), p(2,0))).get());
        assertFalse(GeomUtil.findCenterOfVertices(Collections.emptyList()).isPresent());

        Rectangle2D box = GeomUtil.boundingBox(Arrays.asList(p(-1,0), p(3,0))).get();
        assertEquals(-1, box.getMinX(), 0.0001);
        assertEquals(4, box.getWidth(), 0.0001);
        assertEquals(GeomUtil.EPS, box.getHeight(), 0.0000001);
        assertFalse(GeomUtil.boundingBox(Collections.emptyList()).isPresent());
    }
}
