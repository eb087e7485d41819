package com.agenttracker.discovery.service.extract;

import com.agenttracker.discovery.util.QuotedPrintable;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * DOM pass over the decoded body. Catches anchors the regex scans miss
 * (attributes spread over lines, unusual nesting).
 */
public class JsoupAnchorStrategy implements LinkExtractionStrategy {

    @Override
    public String name() {
        return "jsoup-dom";
    }

    @Override
    public List<LinkTuple> extract(String raw) {
        List<LinkTuple> tuples = new ArrayList<>();
        if (raw == null || raw.indexOf('<') < 0) {
            return tuples;
        }
        Document document = Jsoup.parse(QuotedPrintable.decodeIfEncoded(raw));
        for (Element anchor : document.select("a[href]")) {
            String url = anchor.attr("href").trim();
            if (!url.startsWith("http://") && !url.startsWith("https://")) {
                continue;
            }
            String title = TextCleaner.clean(anchor.text());
            if (title.isEmpty()) {
                title = TextCleaner.clean(anchor.attr("title"));
            }
            if (!title.isEmpty()) {
                tuples.add(new LinkTuple(title, url));
            }
        }
        return tuples;
    }
}
