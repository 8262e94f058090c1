package com.tyron.gamedit.api.service;

/**
 * Something that holds resources (threads, open files) and must be released explicitly.
 */
public interface Disposable {

    void dispose();
}
