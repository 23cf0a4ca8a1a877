package com.routing.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class LoggingProgressListener implements ProgressListener {
    private static final Logger logger = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onProgress(long processed, long total) {
        if (total < 0) {
            logger.info("Progress: {} groups", processed);
        } else {
            logger.info("Progress: {}/{} groups", processed, total);
        }
    }
}
