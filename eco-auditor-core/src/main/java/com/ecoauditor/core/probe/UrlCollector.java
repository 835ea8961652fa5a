package com.ecoauditor.core.probe;

import com.ecoauditor.core.model.EcosystemIndex;
import com.ecoauditor.core.model.RepositoryRecord;

import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the external URLs referenced by repository records.
 *
 * <p>Sources per record: {@code url}, {@code health_endpoint}, {@code links}, and links
 * embedded in the long description (Markdown {@code [text](target)}, HTML {@code href="..."}
 * and router-style {@code to="..."} attributes). Fenced and inline code is stripped from the
 * description first. Only {@code http}/{@code https} targets are kept; relative links and
 * anchors are ignored. Explicit fields are kept even when malformed, so the prober can
 * report them.
 */
public final class UrlCollector {

    private static final Pattern FENCED_CODE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`[^`\\n]+`");
    private static final Pattern HREF = Pattern.compile("href=[\"']([^\"']+)[\"']");
    private static final Pattern MARKDOWN_LINK = Pattern.compile("\\[[^\\]]*?]\\(([^)\\s]+)(?:\\s+\"[^\"]*\")?\\)");
    private static final Pattern TO_ATTRIBUTE = Pattern.compile("\\bto=[\"']([^\"']+)[\"']");

    private UrlCollector() {
        // Utility class
    }

    /**
     * Collects URLs for every record in the index.
     *
     * @param index ecosystem index
     * @return map from URL to the names of the repositories referencing it, both sorted
     */
    public static SortedMap<String, SortedSet<String>> collect(EcosystemIndex index) {
        SortedMap<String, SortedSet<String>> result = new TreeMap<>();
        for (RepositoryRecord record : index.records().values()) {
            for (String url : urlsOf(record)) {
                result.computeIfAbsent(url, key -> new TreeSet<>()).add(record.name());
            }
        }
        return result;
    }

    /**
     * Collects the URLs referenced by one record.
     *
     * @param record repository record
     * @return sorted unique URLs
     */
    public static SortedSet<String> urlsOf(RepositoryRecord record) {
        SortedSet<String> urls = new TreeSet<>();
        addExplicit(urls, record.url());
        addExplicit(urls, record.healthEndpoint());
        record.links().forEach(link -> addExplicit(urls, link));
        urls.addAll(extractLinks(record.longDescription()));
        return urls;
    }

    /**
     * Extracts http(s) link targets from Markdown/HTML text.
     *
     * @param content text, may be null
     * @return sorted unique link targets
     */
    public static SortedSet<String> extractLinks(String content) {
        SortedSet<String> links = new TreeSet<>();
        if (content == null || content.isBlank()) {
            return links;
        }
        String text = FENCED_CODE.matcher(content).replaceAll("");
        text = INLINE_CODE.matcher(text).replaceAll("");

        for (Pattern pattern : List.of(HREF, MARKDOWN_LINK, TO_ATTRIBUTE)) {
            Matcher matcher = pattern.matcher(text);
            while (matcher.find()) {
                String target = matcher.group(1).trim();
                if (isHttp(target)) {
                    links.add(target);
                }
            }
        }
        return links;
    }

    private static void addExplicit(SortedSet<String> urls, String value) {
        if (value != null && !value.isBlank()) {
            urls.add(value.trim());
        }
    }

    private static boolean isHttp(String target) {
        String lower = target.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }
}
