package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.dto.pipeline.CandidateItem;
import com.agenttracker.discovery.dto.pipeline.SearchHit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one unit of raw content into candidate items. No I/O and no shared state.
 *
 * Newsletter bodies go through a layered pass:
 * <ol>
 *   <li>section segmentation by the format's boundary markers</li>
 *   <li>link strategies in order, first non-empty result wins per section</li>
 *   <li>URL canonicalization and dedup by URL or title within the unit</li>
 *   <li>promotional filtering</li>
 *   <li>loose title/description fallback when nothing survived</li>
 * </ol>
 * Malformed input never raises; the worst case is an empty result.
 */
@Component
@Slf4j
public class ContentExtractor {

    private final List<LinkExtractionStrategy> strategies;

    public ContentExtractor() {
        this(defaultStrategies());
    }

    public ContentExtractor(List<LinkExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public static List<LinkExtractionStrategy> defaultStrategies() {
        return List.of(
                RegexAnchorStrategy.quotedPrintable(),
                RegexAnchorStrategy.html(),
                new JsoupAnchorStrategy(),
                RegexAnchorStrategy.markdown()
        );
    }

    /**
     * Extract candidates from a newsletter or other semi-structured body.
     *
     * @param raw    body text or markup, may be null
     * @param format layout of the body
     * @param origin label of the sender, used for provenance and synthetic sources
     */
    public ExtractionResult extract(String raw, NewsletterFormat format, String origin) {
        if (raw == null) {
            return ExtractionResult.absent();
        }
        NewsletterFormat effectiveFormat = format != null ? format : NewsletterFormat.GENERIC;
        Map<String, String> sections = Map.of();
        try {
            sections = SectionSegmenter.segment(raw, effectiveFormat);
            Collection<String> units = sections.isEmpty() ? List.of(raw) : sections.values();

            List<LinkTuple> tuples = new ArrayList<>();
            Set<String> usedStrategies = new HashSet<>();
            for (String unit : units) {
                for (LinkExtractionStrategy strategy : strategies) {
                    List<LinkTuple> found = strategy.extract(unit);
                    if (!found.isEmpty()) {
                        tuples.addAll(found);
                        usedStrategies.add(strategy.name());
                        break;
                    }
                }
            }

            List<CandidateItem> items = toCandidates(filter(tuples), origin);
            if (!items.isEmpty()) {
                return new ExtractionResult(items, sections, ExtractionOutcome.EXTRACTED, String.join(",", usedStrategies));
            }

            List<CandidateItem> fallbackItems = fallback(units, effectiveFormat, origin);
            if (!fallbackItems.isEmpty()) {
                return new ExtractionResult(fallbackItems, sections, ExtractionOutcome.FALLBACK, "fallback");
            }
            return ExtractionResult.empty(sections);
        } catch (RuntimeException e) {
            log.warn("Extraction failed, returning no items: origin={}, format={}, error={}",
                    origin, effectiveFormat, e.getMessage());
            return ExtractionResult.empty(sections);
        }
    }

    /**
     * One candidate per search hit, fields taken verbatim. Hits without a URL are skipped.
     */
    public List<CandidateItem> fromSearchHits(List<SearchHit> hits, String query, String origin) {
        List<CandidateItem> items = new ArrayList<>();
        if (hits == null) {
            return items;
        }
        for (SearchHit hit : hits) {
            if (hit == null || hit.url() == null || hit.url().isBlank()) {
                continue;
            }
            items.add(CandidateItem.builder()
                    .title(hit.title())
                    .description(hit.snippet())
                    .source(hit.url())
                    .searchQuery(query)
                    .origin(origin)
                    .build());
        }
        return items;
    }

    /**
     * Canonicalize, drop repeats by URL or title, drop promotional titles.
     */
    static List<LinkTuple> filter(List<LinkTuple> tuples) {
        List<LinkTuple> kept = new ArrayList<>();
        Set<String> seenUrls = new HashSet<>();
        Set<String> seenTitles = new HashSet<>();
        for (LinkTuple tuple : tuples) {
            String url = LinkNormalizer.normalize(tuple.url());
            if (url == null || url.isBlank()) {
                continue;
            }
            if (seenUrls.contains(url) || seenTitles.contains(tuple.title())) {
                continue;
            }
            seenUrls.add(url);
            seenTitles.add(tuple.title());
            if (PromotionalFilter.isPromotional(tuple.title())) {
                continue;
            }
            kept.add(tuple.withUrl(url));
        }
        return kept;
    }

    private List<CandidateItem> toCandidates(List<LinkTuple> tuples, String origin) {
        List<CandidateItem> items = new ArrayList<>();
        for (LinkTuple tuple : tuples) {
            items.add(CandidateItem.builder()
                    .title(tuple.title())
                    .description(tuple.description() != null ? tuple.description() : tuple.title())
                    .source(tuple.url())
                    .categoryHint(tuple.category())
                    .popularity(tuple.popularity())
                    .origin(origin)
                    .build());
        }
        return items;
    }

    private List<CandidateItem> fallback(Collection<String> units, NewsletterFormat format, String origin) {
        List<CandidateItem> items = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        for (String unit : units) {
            for (FallbackSegmenter.Entry entry : FallbackSegmenter.segment(unit, format)) {
                if (!seenTitles.add(entry.title())) {
                    continue;
                }
                items.add(CandidateItem.builder()
                        .title(entry.title())
                        .description(entry.description())
                        .source(syntheticSource(origin, entry.title()))
                        .origin(origin)
                        .build());
            }
        }
        return items;
    }

    /**
     * Stable identity for items that carry no link, so re-imports hit the same key.
     */
    static String syntheticSource(String origin, String title) {
        String originSlug = TextCleaner.slug(origin);
        return "newsletter:" + (originSlug.isEmpty() ? "unknown" : originSlug) + "#" + TextCleaner.slug(title);
    }
}
