package com.delta.acquisition.acquire.scraper;

public interface BrowserDriver {
    BrowserSession open(BrowserProfile profile);
}
