package com.urbancanopy.util;

import java.io.Closeable;
import java.util.Iterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/** An {@link Iterator} over an underlying resource that must be closed when the caller is done reading. */
public interface CloseableIterator<T> extends Closeable, Iterator<T> {

  @Override
  void close();

  /** Returns a sequential stream over the remaining elements that closes this iterator when the stream is closed. */
  default Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, 0), false).onClose(this::close);
  }
}
