package org.ptnet.model;

import java.awt.geom.Point2D;
import java.util.Objects;

/**
 * Common part of places and transitions: identity, label and layout.
 *
 * The position is the centre of the drawn shape; the offset translates the
 * label from its usual spot below the shape.
 */
public abstract class Node {

    private final String id;
    private String label;
    private final Point2D.Double offset = new Point2D.Double(0, 0);
    private final Point2D.Double position = new Point2D.Double(0, 0);
    private Net net;

    protected Node(String id, String label) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.label = Objects.requireNonNull(label, "label cannot be null");
    }

    public String getId() {
        return id;
    }

    public String getLabel() {
        return label;
    }

    public void setLabel(String label) {
        this.label = Objects.requireNonNull(label, "label cannot be null");
    }

    public Point2D.Double getOffset() {
        return new Point2D.Double(offset.x, offset.y);
    }

    public void setOffset(double x, double y) {
        offset.setLocation(x, y);
    }

    public Point2D.Double getPosition() {
        return new Point2D.Double(position.x, position.y);
    }

    public void setPosition(double x, double y) {
        position.setLocation(x, y);
    }

    /** Owning net, or null before the node is added to one. */
    public Net getNet() {
        return net;
    }

    void setNet(Net net) {
        this.net = net;
    }

    /** Short name of the node kind as used in PNML: {@code place} or {@code transition}. */
    public abstract String getKind();

    @Override
    public String toString() {
        return label;
    }
}
