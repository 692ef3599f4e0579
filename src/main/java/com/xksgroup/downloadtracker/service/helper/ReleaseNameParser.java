package com.xksgroup.downloadtracker.service.helper;

import com.xksgroup.downloadtracker.model.library.ParsedRelease;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts title, year and season/episode from a release file name such as
 * {@code Show.Name.S06E18.1080p.WEB-DL.x264-GROUP.mkv}.
 */
@Slf4j
public final class ReleaseNameParser {

    private static final Pattern EXTENSION = Pattern.compile(
            "\\.(mkv|mp4|avi|m4v|wmv|mov|ts|nzb|iso|mpg|mpeg)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern BRACKET_TAG = Pattern.compile("^\\s*\\[[^\\]]*\\]\\s*|\\s*\\[[^\\]]*\\]\\s*$");

    // S01E02, S01E02E03, S01E02-E03
    private static final Pattern SXXEXX = Pattern.compile(
            "\\bS(\\d{1,2})\\s?((?:[-\\s]?E\\d{1,3})+)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern EPISODE_NUMBER = Pattern.compile("E(\\d{1,3})", Pattern.CASE_INSENSITIVE);
    // 1x02
    private static final Pattern NXNN = Pattern.compile("\\b(\\d{1,2})x(\\d{2,3})\\b", Pattern.CASE_INSENSITIVE);
    // Season 1 Episode 2
    private static final Pattern VERBOSE = Pattern.compile(
            "\\bSeason\\s?(\\d{1,2})\\s?Episode\\s?(\\d{1,3})\\b", Pattern.CASE_INSENSITIVE);
    // Season packs: S01, Season 1
    private static final Pattern SEASON_ONLY = Pattern.compile(
            "\\b(?:S|Season\\s?)(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE);

    private static final Pattern YEAR = Pattern.compile("\\b(19\\d{2}|20\\d{2})\\b");
    private static final Pattern RELEASE_TOKEN = Pattern.compile(
            "\\b(2160p|1080p|1080i|720p|576p|480p|4k|uhd|web[- ]?dl|webrip|bluray|blu[- ]ray|brrip|bdrip"
                    + "|dvdrip|hdtv|hdrip|x264|x265|h[ .]?264|h[ .]?265|hevc|avc|xvid|aac|ac3|dts|ddp?5[ .]1"
                    + "|atmos|hdr|hdr10|remux|proper|repack|internal|10bit|amzn|dsnp|hmax)\\b",
            Pattern.CASE_INSENSITIVE);

    private ReleaseNameParser() {
    }

    /**
     * Parses and normalises in one step. Season and episode come out as single values.
     */
    public static ParsedRelease parse(String filename) {
        RawRelease raw = parseRaw(filename);
        ParsedRelease parsed = new ParsedRelease(
                raw.title(),
                raw.year(),
                EpisodeNumberNormalizer.toSingle(raw.seasons()),
                EpisodeNumberNormalizer.toSingle(raw.episodes()));
        log.debug("Parsed '{}' -> title='{}', year={}, S{}E{}",
                filename, parsed.title(), parsed.year(), parsed.season(), parsed.episode());
        return parsed;
    }

    public static RawRelease parseRaw(String filename) {
        if (filename == null || filename.isBlank()) {
            return new RawRelease("", null, List.of(), List.of());
        }

        String name = EXTENSION.matcher(filename.trim()).replaceFirst("");
        name = BRACKET_TAG.matcher(name).replaceAll("");
        String spaced = name.replace('.', ' ').replace('_', ' ').replaceAll("\\s+", " ").trim();

        List<Integer> seasons = new ArrayList<>();
        List<Integer> episodes = new ArrayList<>();
        int titleEnd = spaced.length();

        Matcher matcher = SXXEXX.matcher(spaced);
        if (matcher.find()) {
            seasons.add(Integer.parseInt(matcher.group(1)));
            Matcher episodeMatcher = EPISODE_NUMBER.matcher(matcher.group(2));
            while (episodeMatcher.find()) {
                episodes.add(Integer.parseInt(episodeMatcher.group(1)));
            }
            titleEnd = matcher.start();
        } else if ((matcher = NXNN.matcher(spaced)).find()) {
            seasons.add(Integer.parseInt(matcher.group(1)));
            episodes.add(Integer.parseInt(matcher.group(2)));
            titleEnd = matcher.start();
        } else if ((matcher = VERBOSE.matcher(spaced)).find()) {
            seasons.add(Integer.parseInt(matcher.group(1)));
            episodes.add(Integer.parseInt(matcher.group(2)));
            titleEnd = matcher.start();
        } else if ((matcher = SEASON_ONLY.matcher(spaced)).find() && matcher.start() > 0) {
            seasons.add(Integer.parseInt(matcher.group(1)));
            titleEnd = matcher.start();
        }

        Matcher token = RELEASE_TOKEN.matcher(spaced);
        if (token.find() && token.start() > 0) {
            titleEnd = Math.min(titleEnd, token.start());
        }

        // The last year before the title end; a leading year belongs to the title
        Integer year = null;
        int yearStart = -1;
        Matcher yearMatcher = YEAR.matcher(spaced);
        while (yearMatcher.find()) {
            if (yearMatcher.start() == 0) {
                continue;
            }
            if (yearMatcher.start() > titleEnd) {
                break;
            }
            year = Integer.parseInt(yearMatcher.group(1));
            yearStart = yearMatcher.start();
        }
        if (yearStart > 0) {
            titleEnd = Math.min(titleEnd, yearStart);
        }

        String title = cleanTitle(spaced.substring(0, titleEnd));
        if (title.isEmpty()) {
            title = cleanTitle(spaced);
        }
        return new RawRelease(title, year, seasons, episodes);
    }

    private static String cleanTitle(String title) {
        return title
                .replaceAll("[\\s(\\[\\-]+$", "")
                .replaceAll("^[\\s\\-]+", "")
                .trim();
    }
}
