package com.example.demo.deckgen.geometry;

import com.example.demo.deckgen.remote.AffineTransform;
import com.example.demo.deckgen.remote.PageElement;
import com.example.demo.deckgen.remote.Size;
import lombok.Value;

/**
 * Axis aligned box in EMU.
 */
@Value
public class BoundingBox {
    double x;
    double y;
    double width;
    double height;

    /**
     * Box covered by an element once its transform is applied.
     *
     * @throws IllegalArgumentException if the element has no size
     */
    public static BoundingBox of(PageElement element) {
        Size size = element.getSize();
        if (size == null || size.getWidth() == null || size.getHeight() == null
                || size.getWidth().getMagnitude() == null || size.getHeight().getMagnitude() == null) {
            throw new IllegalArgumentException("Element " + element.getObjectId() + " has no size");
        }
        double width = size.getWidth().getMagnitude();
        double height = size.getHeight().getMagnitude();
        AffineTransform t = element.getTransform();
        double scaleX = t != null && t.getScaleX() != null ? t.getScaleX() : 1;
        double scaleY = t != null && t.getScaleY() != null ? t.getScaleY() : 1;
        double shearX = t != null && t.getShearX() != null ? t.getShearX() : 0;
        double shearY = t != null && t.getShearY() != null ? t.getShearY() : 0;
        double translateX = t != null && t.getTranslateX() != null ? t.getTranslateX() : 0;
        double translateY = t != null && t.getTranslateY() != null ? t.getTranslateY() : 0;
        return new BoundingBox(
                translateX,
                translateY,
                scaleX * width + shearX * height,
                scaleY * height + shearY * width);
    }

    public static BoundingBox page(Size pageSize) {
        return new BoundingBox(0, 0, pageSize.getWidth().getMagnitude(), pageSize.getHeight().getMagnitude());
    }

    public static boolean hasSize(PageElement element) {
        Size size = element.getSize();
        return size != null && size.getWidth() != null && size.getHeight() != null
                && size.getWidth().getMagnitude() != null && size.getHeight().getMagnitude() != null;
    }
}
