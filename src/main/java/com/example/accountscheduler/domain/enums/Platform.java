package com.example.accountscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Platforms a job can post to. Each platform maps to one executor.
 */
@Getter
@RequiredArgsConstructor
public enum Platform {

    TIKTOK("tiktok", "TikTok"),

    INSTAGRAM_REELS("instagram_reels", "Instagram Reels"),

    YOUTUBE_SHORTS("youtube_shorts", "YouTube Shorts");

    private final String code;
    private final String displayName;

    /**
     * Accepts either the code ({@code instagram_reels}) or the constant name ({@code INSTAGRAM_REELS})
     */
    public static Platform fromCode(String code) {
        for (var platform : values()) {
            if (platform.getCode().equalsIgnoreCase(code) || platform.name().equalsIgnoreCase(code)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Unknown platform: " + code);
    }
}
