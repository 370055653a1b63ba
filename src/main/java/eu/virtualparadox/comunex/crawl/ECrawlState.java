package eu.virtualparadox.comunex.crawl;

public enum ECrawlState {
    SEEDING,
    CRAWLING,
    DONE
}
