package com.soartech.cmakels;

import com.google.common.collect.ImmutableSet;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystemNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.TextDocumentItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This class owns and maintains the CMakeFiles that are known to the server, and provides safe
 * concurrent access to them.
 */
public class Documents {
  private static final Logger LOG = LoggerFactory.getLogger(Documents.class);

  /**
   * The current state of the documents in the workspace. The documents may or may not be open in
   * the client. If they are, then the state comes from the client; if they are not, then the state
   * comes from the filesystem.
   */
  private final ConcurrentHashMap<URI, CMakeFile> documents = new ConcurrentHashMap<>();

  /**
   * The set of URIs that point to currently open documents. This is a subset of the keys of the
   * documents hash map.
   */
  private final Set<URI> openDocuments = ConcurrentHashMap.newKeySet();

  /**
   * Retrieve the file with the given URI, reading it from the filesystem if necessary. Returns null
   * if the file is not open and cannot be read.
   */
  public CMakeFile get(URI uri) {
    return documents.computeIfAbsent(uri, Documents::readFile);
  }

  /**
   * Get the set of currently open URIs. While the document manager may hold files in memory even if
   * the client does not have them open, this set will only contain the URIs of the files which are
   * open in the client.
   */
  public ImmutableSet<URI> openUris() {
    return ImmutableSet.copyOf(openDocuments);
  }

  /** Add a document that was received via a textDocument/didOpen notification. */
  public CMakeFile open(TextDocumentItem doc) {
    URI uri = CMakeDocumentService.uri(doc.getUri());
    CMakeFile file = new CMakeFile(uri, doc.getText());
    documents.put(file.uri, file);
    openDocuments.add(file.uri);
    return file;
  }

  /**
   * Remove a URI from the set of currently open files. The next time the file is needed, it is read
   * from the filesystem again, since the client may have discarded unsaved changes.
   */
  public void close(URI uri) {
    openDocuments.remove(uri);
    documents.remove(uri);
  }

  /** Apply a sequence of changes that were received via a textDocument/didChange notification. */
  public CMakeFile applyChanges(DidChangeTextDocumentParams params) {
    URI uri = CMakeDocumentService.uri(params.getTextDocument().getUri());
    return documents.compute(
        uri,
        (key, file) -> {
          if (file == null) {
            LOG.warn("Received changes for {}, which is not open", key);
            file = new CMakeFile(key, "");
          }
          return file.withChanges(params.getContentChanges());
        });
  }

  private static CMakeFile readFile(URI uri) {
    try {
      Path path = Paths.get(uri);
      String contents = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
      return new CMakeFile(uri, contents);
    } catch (IOException | IllegalArgumentException | FileSystemNotFoundException e) {
      LOG.error("Failed to open file {}", uri, e);
      return null;
    }
  }
}
