package com.openforge.mcpchat.llm;

import com.openforge.mcpchat.llm.model.Delta;

import java.util.Iterator;

/**
 * A live streamed response. {@link #hasNext()} blocks until the next delta or
 * the end of the stream.
 *
 * {@link #close()} may be called from another thread to cancel: the underlying
 * transport is released and no further deltas are produced.
 */
public interface CompletionStream extends Iterator<Delta>, AutoCloseable {

    @Override
    void close();
}
