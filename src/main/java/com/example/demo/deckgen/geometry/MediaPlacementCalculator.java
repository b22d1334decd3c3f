package com.example.demo.deckgen.geometry;

import com.example.demo.deckgen.exception.UnsupportedContentException;
import com.example.demo.deckgen.model.ImageDefinition;
import com.example.demo.deckgen.model.VideoDefinition;
import com.example.demo.deckgen.remote.Size;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits images and videos into a target box: scale uniformly so the content
 * extent fits both dimensions, then center it, splitting the slack evenly.
 *
 * Image sizes, paddings and offsets are in pixels, boxes in EMU. The scale ratio
 * therefore converts pixels to EMU and fits in a single step.
 */
@Component
public class MediaPlacementCalculator {

    /**
     * Packs the images left to right and fits the group into the box.
     *
     * @return one placement per image, in input order
     */
    public List<Placement> placeImages(List<ImageDefinition> images, BoundingBox box) {
        PackedLayout<ImageDefinition> layout = pack(images);
        if (layout.getWidth() <= 0 || layout.getHeight() <= 0) {
            throw new UnsupportedContentException("Cannot place images without a size: " + describe(images));
        }

        double ratio = Math.min(box.getWidth() / layout.getWidth(), box.getHeight() / layout.getHeight());
        double baseX = box.getX() + (box.getWidth() - layout.getWidth() * ratio) / 2;
        double baseY = box.getY() + (box.getHeight() - layout.getHeight() * ratio) / 2;

        List<Placement> placements = new ArrayList<>(images.size());
        for (PackedItem<ImageDefinition> item : layout.getItems()) {
            ImageDefinition image = item.getMeta();
            placements.add(new Placement(
                    baseX + (item.getX() + image.getPadding() + image.getOffsetX()) * ratio,
                    baseY + (item.getY() + image.getPadding() + image.getOffsetY()) * ratio,
                    image.getWidth() * ratio,
                    image.getHeight() * ratio));
        }
        return placements;
    }

    public Placement placeVideo(VideoDefinition video, BoundingBox box) {
        if (video.getWidth() <= 0 || video.getHeight() <= 0) {
            throw new UnsupportedContentException("Cannot place video " + video.getId() + " without a size");
        }
        double ratio = Math.min(box.getWidth() / video.getWidth(), box.getHeight() / video.getHeight());
        double width = video.getWidth() * ratio;
        double height = video.getHeight() * ratio;
        return new Placement(
                box.getX() + (box.getWidth() - width) / 2,
                box.getY() + (box.getHeight() - height) / 2,
                width,
                height);
    }

    /**
     * Region for images that have no placeholder: their natural size, capped at half
     * the page in each dimension, centered on the page.
     */
    public BoundingBox centeredRegion(List<ImageDefinition> images, Size pageSize) {
        PackedLayout<ImageDefinition> layout = pack(images);
        double halfWidth = pageSize.getWidth().getMagnitude() * 0.5;
        double halfHeight = pageSize.getHeight().getMagnitude() * 0.5;
        double width = Math.min(Units.pixelsToEmu(layout.getWidth()), halfWidth);
        double height = Math.min(Units.pixelsToEmu(layout.getHeight()), halfHeight);
        return new BoundingBox(halfWidth - width / 2, halfHeight - height / 2, width, height);
    }

    private PackedLayout<ImageDefinition> pack(List<ImageDefinition> images) {
        LeftRightPacker<ImageDefinition> packer = new LeftRightPacker<>();
        for (ImageDefinition image : images) {
            packer.add(image.getWidth() + image.getPadding() * 2, image.getHeight() + image.getPadding() * 2, image);
        }
        return packer.export();
    }

    private static String describe(List<ImageDefinition> images) {
        List<String> urls = new ArrayList<>();
        for (ImageDefinition image : images) {
            urls.add(image.getUrl());
        }
        return String.join(", ", urls);
    }
}
