package dev.trawler.render;

import org.jspecify.annotations.Nullable;

public record PageMetadata(
    @Nullable String title, @Nullable String description, String sourceUrl) {}
