package org.allenai.academicreader.pdfapi;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Path-keyed cache of loaded documents. Entries are created on first request and live until the
 * cache is closed; there is no eviction.
 *
 * First load of a path is guarded per path, so concurrent first requests for the same document
 * produce exactly one underlying handle. Loads of different paths do not block each other. A
 * load that finishes after {@link #close()} closes its own document instead of caching it.
 */
@Slf4j
public class DocumentCache<T extends Closeable> implements Closeable {
  public interface Loader<T> {
    T load(Path path) throws IOException;
  }

  private final Loader<T> loader;
  private final ConcurrentHashMap<Path, T> documents = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<Path, Object> loadGuards = new ConcurrentHashMap<>();
  private volatile boolean closed = false;

  public DocumentCache(final Loader<T> loader) {
    this.loader = loader;
  }

  private static Path key(final Path path) {
    return path.toAbsolutePath().normalize();
  }

  public T get(final Path path) throws IOException {
    Preconditions.checkState(!closed, "Document cache is closed");
    final Path key = key(path);
    final T cached = documents.get(key);
    if(cached != null)
      return cached;

    final Object guard = loadGuards.computeIfAbsent(key, k -> new Object());
    synchronized (guard) {
      T doc = documents.get(key);
      if(doc == null) {
        try {
          Preconditions.checkState(!closed, "Document cache is closed");
          log.info("Loading document {}", key);
          doc = loader.load(key);
          documents.put(key, doc);
        } finally {
          // the document, if any, is in the map by now; later callers find it there
          loadGuards.remove(key, guard);
        }
        // close() may have run during the load; whoever removes the entry closes the document
        if(closed) {
          if(documents.remove(key, doc))
            doc.close();
          throw new IllegalStateException("Document cache was closed while loading " + key);
        }
      }
      return doc;
    }
  }

  @VisibleForTesting
  int pendingLoads() {
    return loadGuards.size();
  }

  public boolean contains(final Path path) {
    return documents.containsKey(key(path));
  }

  public int size() {
    return documents.size();
  }

  @Override
  public void close() throws IOException {
    closed = true;
    IOException first = null;
    for(final Path key : documents.keySet()) {
      final T doc = documents.remove(key);
      if(doc == null)
        continue;
      try {
        doc.close();
      } catch(final IOException e) {
        log.warn("Exception while closing cached document {}", key, e);
        if(first == null)
          first = e;
      }
    }
    loadGuards.clear();
    if(first != null)
      throw first;
  }
}
