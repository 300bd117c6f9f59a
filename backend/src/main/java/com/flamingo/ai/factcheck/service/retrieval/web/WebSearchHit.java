package com.flamingo.ai.factcheck.service.retrieval.web;

/** One web search result. */
public record WebSearchHit(String title, String url, String content) {}
