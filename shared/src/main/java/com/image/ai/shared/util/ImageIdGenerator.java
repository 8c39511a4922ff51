package com.image.ai.shared.util;

import java.util.UUID;

public final class ImageIdGenerator {

    private ImageIdGenerator() {}

    public static String generate() {
        return UUID.randomUUID().toString();
    }
}
