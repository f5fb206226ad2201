package org.cellpainting.loaddata.domain.manifest;

/**
 * An image left out of the manifest because an earlier image already filled the same
 * (well, site, cycle, channels) slot.
 *
 * @param well well of the bucket
 * @param site site of the bucket
 * @param channels raw channel list shared by both images
 * @param fileName file name of the image left out
 * @param keptFileName file name of the image that fills the slot
 * @since 0.1.0
 */
public record DisplacedImage(String well, String site, String channels, String fileName, String keptFileName) {
}
