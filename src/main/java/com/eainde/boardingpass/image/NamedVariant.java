package com.eainde.boardingpass.image;

import java.awt.image.BufferedImage;

/**
 * A preprocessed copy of the page, labelled so diagnostics can tell which variant produced a read.
 */
public record NamedVariant(String name, BufferedImage image) {
}
