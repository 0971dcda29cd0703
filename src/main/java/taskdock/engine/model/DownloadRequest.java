package taskdock.engine.model;

import java.util.Objects;

/**
 * Caller-supplied description of one download.
 * The scheduler treats it as opaque apart from {@link #url()}, which it puts into event data.
 */
public record DownloadRequest(
        String url,
        String outputDir,
        String videoFormatId,
        String audioFormatId,
        boolean useCookies,
        String cookiesFile,
        boolean preferMp4,
        boolean noPlaylist,
        String proxyUrl) {

    public static final String BEST = "best";

    public DownloadRequest {
        Objects.requireNonNull(url, "url is required");
        if (videoFormatId == null || videoFormatId.isBlank()) {
            videoFormatId = BEST;
        }
        if (audioFormatId == null || audioFormatId.isBlank()) {
            audioFormatId = BEST;
        }
    }

    /** Request with default formats and options */
    public static DownloadRequest of(String url, String outputDir) {
        return new DownloadRequest(url, outputDir, BEST, BEST, false, null, true, true, null);
    }

    /**
     * Combined format selector: "video+audio", or just the video id when audio is "best".
     */
    public String formatSpec() {
        if (!BEST.equals(audioFormatId)) {
            return videoFormatId + "+" + audioFormatId;
        }
        return videoFormatId;
    }

    public DownloadRequest withFormats(String videoFormatId, String audioFormatId) {
        return new DownloadRequest(url, outputDir, videoFormatId, audioFormatId, useCookies, cookiesFile,
                preferMp4, noPlaylist, proxyUrl);
    }

    public DownloadRequest withCookies(String cookiesFile) {
        return new DownloadRequest(url, outputDir, videoFormatId, audioFormatId, true, cookiesFile,
                preferMp4, noPlaylist, proxyUrl);
    }

    public DownloadRequest withProxy(String proxyUrl) {
        return new DownloadRequest(url, outputDir, videoFormatId, audioFormatId, useCookies, cookiesFile,
                preferMp4, noPlaylist, proxyUrl);
    }
}
