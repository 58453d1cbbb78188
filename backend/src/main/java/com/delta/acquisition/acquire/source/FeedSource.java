package com.delta.acquisition.acquire.source;

import com.delta.acquisition.acquire.http.PoliteHttpClient;
import com.delta.acquisition.acquire.http.RequestIdentity;
import com.delta.acquisition.acquire.jobs.PostingFields;
import com.delta.acquisition.acquire.jobs.PostingNormalizer;
import com.delta.acquisition.acquire.model.HttpFetchResult;
import com.delta.acquisition.acquire.model.NormalizedJobPosting;
import com.delta.acquisition.acquire.model.SearchParameters;
import com.delta.acquisition.acquire.util.ReasonCodeClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import static com.delta.acquisition.acquire.jobs.PostingFields.firstNonBlank;

/**
 * RSS 2.0 and Atom job feeds.
 */
@Component
public class FeedSource {
    public static final String METHOD = "feed";
    private static final Logger log = LoggerFactory.getLogger(FeedSource.class);
    private static final String FEED_ACCEPT = "application/rss+xml,application/atom+xml,application/xml;q=0.9,*/*;q=0.8";

    private final PoliteHttpClient httpClient;
    private final PostingNormalizer normalizer;

    public FeedSource(PoliteHttpClient httpClient, PostingNormalizer normalizer) {
        this.httpClient = httpClient;
        this.normalizer = normalizer;
    }

    public List<NormalizedJobPosting> fetch(String feedUrl, SearchParameters search, RequestIdentity identity) {
        HttpFetchResult fetch = httpClient.get(feedUrl, FEED_ACCEPT, identity);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            throw SourceFetchException.fromFetch(METHOD, fetch);
        }
        List<NormalizedJobPosting> postings = parse(fetch.body(), feedUrl);
        log.debug("Feed {} yielded {} postings", feedUrl, postings.size());
        return PostingFields.filter(postings, search);
    }

    List<NormalizedJobPosting> parse(String xmlPayload, String feedUrl) {
        Document xml = Jsoup.parse(xmlPayload, "", Parser.xmlParser());
        Element rssChannel = xml.selectFirst("rss > channel");
        if (rssChannel != null) {
            return parseRss(rssChannel, feedUrl);
        }
        Element atomFeed = xml.selectFirst("feed");
        if (atomFeed != null) {
            return parseAtom(atomFeed, feedUrl);
        }
        throw new SourceFetchException(ReasonCodeClassifier.PARSING_FAILED, 0, "feed_invalid_payload");
    }

    private List<NormalizedJobPosting> parseRss(Element channel, String feedUrl) {
        String orgName = childText(channel, "title");
        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (Element item : channel.getElementsByTag("item")) {
            NormalizedJobPosting posting = normalizer.build(
                feedUrl,
                firstNonBlank(childText(item, "link"), childText(item, "guid")),
                childText(item, "title"),
                firstNonBlank(childText(item, "company"), childText(item, "job:company"), orgName),
                firstNonBlank(childText(item, "location"), childText(item, "job:location")),
                firstNonBlank(childText(item, "type"), childText(item, "job:type")),
                parseDate(firstNonBlank(childText(item, "pubDate"), childText(item, "dc:date"))),
                PostingFields.htmlToText(childText(item, "description")),
                firstNonBlank(childText(item, "salary"), childText(item, "job:salary")),
                childText(item, "guid"),
                METHOD,
                1.0
            );
            if (posting != null) {
                postings.add(posting);
            }
        }
        return postings;
    }

    private List<NormalizedJobPosting> parseAtom(Element feed, String feedUrl) {
        String orgName = firstNonBlank(childText(feed, "author > name"), childText(feed, "title"));
        List<NormalizedJobPosting> postings = new ArrayList<>();
        for (Element entry : feed.getElementsByTag("entry")) {
            NormalizedJobPosting posting = normalizer.build(
                feedUrl,
                atomLink(entry),
                childText(entry, "title"),
                firstNonBlank(childText(entry, "author > name"), orgName),
                childText(entry, "location"),
                null,
                parseDate(firstNonBlank(childText(entry, "published"), childText(entry, "updated"))),
                PostingFields.htmlToText(firstNonBlank(childText(entry, "summary"), childText(entry, "content"))),
                null,
                childText(entry, "id"),
                METHOD,
                1.0
            );
            if (posting != null) {
                postings.add(posting);
            }
        }
        return postings;
    }

    private String atomLink(Element entry) {
        String fallback = null;
        for (Element link : entry.getElementsByTag("link")) {
            String href = link.attr("href");
            if (href.isBlank()) {
                continue;
            }
            String rel = link.attr("rel");
            if (rel.isBlank() || "alternate".equals(rel)) {
                return href.trim();
            }
            if (fallback == null) {
                fallback = href.trim();
            }
        }
        return fallback;
    }

    private String childText(Element parent, String selector) {
        Element child;
        if (selector.contains(":")) {
            child = parent.getElementsByTag(selector).first();
        } else {
            child = parent.selectFirst("> " + selector);
        }
        if (child == null) {
            return null;
        }
        String text = child.text();
        return text == null || text.isBlank() ? null : text.trim();
    }

    static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return ZonedDateTime.parse(value.trim(), DateTimeFormatter.RFC_1123_DATE_TIME).toLocalDate();
        } catch (DateTimeParseException ignored) {
            return PostingFields.parseIsoDate(value);
        }
    }
}
