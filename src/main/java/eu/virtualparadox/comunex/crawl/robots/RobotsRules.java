package eu.virtualparadox.comunex.crawl.robots;

import org.apache.commons.lang3.StringUtils;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parsed robots.txt for one origin, already narrowed to the group that applies to our agent.
 * <p>
 * Rules are evaluated in file order and the first one whose path prefix matches wins.
 * An empty {@code Disallow:} allows everything. When the file could not be loaded the rules
 * are "unloaded" and every URL is allowed.
 * </p>
 */
public final class RobotsRules {

    private static final String SITEMAP_PREFIX = "sitemap:";

    private final boolean loaded;
    private final boolean enforced;
    private final List<Rule> rules;
    private final Duration declaredDelay;
    private final Duration minDelay;
    private final List<String> sitemaps;

    private RobotsRules(final boolean loaded,
                        final boolean enforced,
                        final List<Rule> rules,
                        final Duration declaredDelay,
                        final Duration minDelay,
                        final List<String> sitemaps) {
        this.loaded = loaded;
        this.enforced = enforced;
        this.rules = List.copyOf(rules);
        this.declaredDelay = declaredDelay;
        this.minDelay = minDelay == null ? Duration.ZERO : minDelay;
        this.sitemaps = List.copyOf(sitemaps);
    }

    /**
     * Allow-all rules used when robots.txt is missing or unreachable.
     */
    public static RobotsRules unloaded(final Duration minDelay) {
        return new RobotsRules(false, false, Collections.emptyList(), null, minDelay, Collections.emptyList());
    }

    /**
     * Parses a robots.txt body for the given user agent. The group whose {@code User-agent}
     * token appears in our agent's product name is used, else the {@code *} group.
     */
    public static RobotsRules parse(final String body, final String userAgent, final Duration minDelay) {
        final String agentToken = productToken(userAgent);
        final Map<String, List<String>> byAgent = new LinkedHashMap<>();
        final List<String> sitemaps = new ArrayList<>();

        List<String> currentAgents = new ArrayList<>();
        boolean groupHasRules = false;
        for (final String rawLine : StringUtils.defaultString(body).split("\r?\n|\r")) {
            final String line = StringUtils.substringBefore(rawLine, "#").trim();
            if (line.isEmpty()) {
                continue;
            }
            if (StringUtils.startsWithIgnoreCase(line, SITEMAP_PREFIX)) {
                final String url = line.substring(SITEMAP_PREFIX.length()).trim();
                if (StringUtils.isNotEmpty(url)) {
                    sitemaps.add(url);
                }
            } else if (StringUtils.startsWithIgnoreCase(line, "user-agent:")) {
                if (groupHasRules) {
                    currentAgents = new ArrayList<>();
                    groupHasRules = false;
                }
                final String agent = productToken(line.substring("user-agent:".length()).trim());
                currentAgents.add(agent);
                byAgent.computeIfAbsent(agent, k -> new ArrayList<>());
            } else if (!currentAgents.isEmpty()) {
                groupHasRules = true;
                for (final String agent : currentAgents) {
                    byAgent.get(agent).add(line);
                }
            }
        }

        List<String> chosen = null;
        for (final Map.Entry<String, List<String>> entry : byAgent.entrySet()) {
            if (!"*".equals(entry.getKey()) && !entry.getKey().isEmpty() && agentToken.contains(entry.getKey())) {
                chosen = entry.getValue();
                break;
            }
        }
        if (chosen == null) {
            chosen = byAgent.getOrDefault("*", Collections.emptyList());
        }

        Duration declared = null;
        final List<Rule> rules = new ArrayList<>();
        for (final String line : chosen) {
            if (StringUtils.startsWithIgnoreCase(line, "allow:")) {
                rules.add(new Rule(true, line.substring(6).trim()));
            } else if (StringUtils.startsWithIgnoreCase(line, "disallow:")) {
                final String path = line.substring(9).trim();
                rules.add(new Rule(path.isEmpty(), path));
            } else if (StringUtils.startsWithIgnoreCase(line, "crawl-delay:")) {
                declared = parseDelay(line.substring(12).trim(), declared);
            }
        }
        return new RobotsRules(true, true, rules, declared, minDelay, sitemaps);
    }

    /**
     * Same sitemaps and delay, but every URL is allowed.
     */
    public RobotsRules ignoringAccessRules() {
        return new RobotsRules(loaded, false, rules, declaredDelay, minDelay, sitemaps);
    }

    public boolean isLoaded() {
        return loaded;
    }

    public boolean canFetch(final String url) {
        if (!loaded || !enforced) {
            return true;
        }
        final String path = pathWithQuery(url);
        for (final Rule rule : rules) {
            if (rule.path().isEmpty()) {
                return rule.allow();
            }
            if (rule.matches(path)) {
                return rule.allow();
            }
        }
        return true;
    }

    /**
     * Declared {@code Crawl-delay}, never below the configured minimum.
     */
    public Duration crawlDelay() {
        if (declaredDelay == null || declaredDelay.compareTo(minDelay) < 0) {
            return minDelay;
        }
        return declaredDelay;
    }

    public List<String> sitemapUrls() {
        return loaded ? sitemaps : Collections.emptyList();
    }

    private static Duration parseDelay(final String value, final Duration current) {
        try {
            final double seconds = Double.parseDouble(value);
            if (seconds < 0 || Double.isNaN(seconds) || Double.isInfinite(seconds)) {
                return current;
            }
            return Duration.ofMillis(Math.round(seconds * 1000.0));
        } catch (NumberFormatException e) {
            return current;
        }
    }

    private static String productToken(final String agent) {
        return StringUtils.substringBefore(StringUtils.defaultString(agent), "/").trim().toLowerCase(Locale.ROOT);
    }

    private static String pathWithQuery(final String url) {
        try {
            final URI uri = new URI(url);
            String path = uri.getRawPath();
            if (StringUtils.isEmpty(path)) {
                path = "/";
            }
            return uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
        } catch (URISyntaxException e) {
            return url;
        }
    }

    record Rule(boolean allow, String path) {

        boolean matches(final String candidate) {
            if ("*".equals(path)) {
                return true;
            }
            return candidate.startsWith(path);
        }
    }
}
