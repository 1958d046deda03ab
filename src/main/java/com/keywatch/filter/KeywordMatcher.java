package com.keywatch.filter;

import com.keywatch.shared.config.MonitorConfig;
import com.keywatch.shared.model.Keyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tests message text against the keyword list of a config snapshot.
 * <p>
 * Compiled patterns are cached per keyword list: a snapshot whose list or case setting differs from
 * the cached one triggers a rebuild before matching, so a lookup never runs against a stale set.
 */
public class KeywordMatcher {

    private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);
    // (?i) (?-i) (?iu) (?i: ... any inline group that sets or clears case folding
    private static final Pattern CASE_DIRECTIVE = Pattern.compile("\\(\\?[a-zA-Z]*-?[a-zA-Z]*i[a-zA-Z]*[:)]");

    private final AtomicReference<CompiledSet> cache = new AtomicReference<>();

    public MatchResult match(MonitorConfig snapshot, String text) {
        if (text == null || text.isEmpty() || snapshot.keywords().isEmpty()) {
            return MatchResult.none();
        }
        var compiled = compiledFor(snapshot.keywords(), snapshot.settings().caseSensitive());
        var labels = new ArrayList<String>();
        for (var entry : compiled.patterns().entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                labels.add(entry.getKey());
            }
        }
        return new MatchResult(labels);
    }

    /** Compile-checks a keyword without touching the cache. */
    public static void validate(Keyword keyword) throws PatternException {
        compile(keyword, true);
    }

    static Pattern compile(Keyword keyword, boolean caseSensitive) throws PatternException {
        var source = keyword.isRegex() ? keyword.pattern() : Pattern.quote(keyword.pattern());
        int flags = 0;
        if (!caseSensitive && !hasCaseDirective(keyword)) {
            flags = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
        }
        try {
            return Pattern.compile(source, flags);
        } catch (PatternSyntaxException e) {
            throw new PatternException(keyword.pattern(), e.getDescription() + " near index " + e.getIndex(), e);
        }
    }

    static boolean hasCaseDirective(Keyword keyword) {
        return keyword.isRegex() && CASE_DIRECTIVE.matcher(keyword.pattern()).find();
    }

    private CompiledSet compiledFor(List<Keyword> keywords, boolean caseSensitive) {
        var cached = cache.get();
        if (cached != null && cached.caseSensitive() == caseSensitive
                && (cached.keywords() == keywords || cached.keywords().equals(keywords))) {
            return cached;
        }
        var previous = cached != null && cached.caseSensitive() == caseSensitive
                ? cached.patterns() : Map.<String, Pattern>of();
        var patterns = new LinkedHashMap<String, Pattern>();
        for (var keyword : keywords) {
            var reused = previous.get(keyword.pattern());
            if (reused != null) {
                patterns.put(keyword.pattern(), reused);
                continue;
            }
            try {
                patterns.put(keyword.pattern(), compile(keyword, caseSensitive));
            } catch (PatternException e) {
                // validated on /add and at load time, so this means the list bypassed both
                log.error("Keyword '{}' does not compile: {}", keyword.pattern(), e.getMessage());
            }
        }
        var fresh = new CompiledSet(keywords, caseSensitive, patterns);
        cache.set(fresh);
        log.debug("Compiled {} keyword patterns (caseSensitive={})", patterns.size(), caseSensitive);
        return fresh;
    }

    private record CompiledSet(List<Keyword> keywords, boolean caseSensitive, Map<String, Pattern> patterns) {}
}
