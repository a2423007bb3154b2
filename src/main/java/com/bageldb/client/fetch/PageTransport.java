package com.bageldb.client.fetch;

import com.bageldb.client.model.PageRequest;

import java.io.IOException;

/**
 * Performs the raw GET for one page.
 *
 * <p>An {@link IOException} signals a transport-level failure (refused or reset
 * connection, timeout) and is eligible for retry. Any HTTP response, whatever
 * its status, is returned normally.
 */
@FunctionalInterface
public interface PageTransport {

    TransportResponse get(PageRequest request) throws IOException, InterruptedException;
}
