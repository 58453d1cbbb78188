package com.delta.acquisition.acquire.scraper;

import java.time.Duration;

/**
 * One page in one browser context. Sessions are confined to the thread that opened them.
 */
public interface BrowserSession extends AutoCloseable {
    NavigationResult navigate(String url, Duration timeout);

    String content();

    byte[] screenshot();

    void movePointer(double x, double y);

    void click(double x, double y);

    @Override
    void close();
}
