package com.skmarket.crawler.core;

public enum WaitState {
    ATTACHED,
    VISIBLE,
    HIDDEN
}
