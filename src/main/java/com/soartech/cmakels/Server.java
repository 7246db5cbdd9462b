package com.soartech.cmakels;

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.eclipse.lsp4j.InitializeParams;
import org.eclipse.lsp4j.InitializeResult;
import org.eclipse.lsp4j.InitializedParams;
import org.eclipse.lsp4j.ServerCapabilities;
import org.eclipse.lsp4j.ServerInfo;
import org.eclipse.lsp4j.TextDocumentSyncKind;
import org.eclipse.lsp4j.WorkspaceFolder;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.LanguageServer;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class Server implements LanguageServer, LanguageClientAware {
  private static final Logger LOG = LoggerFactory.getLogger(Server.class);

  private final CMakeDocumentService documentService = new CMakeDocumentService();
  private final CMakeWorkspaceService workspaceService =
      new CMakeWorkspaceService(documentService);

  // The following overrides are defined in the order in which they are called during the lifecycle
  // of the language server.

  @Override
  public WorkspaceService getWorkspaceService() {
    return workspaceService;
  }

  @Override
  public TextDocumentService getTextDocumentService() {
    return documentService;
  }

  @Override
  public void connect(LanguageClient client) {
    LOG.info("connect()");
    workspaceService.connect(client);
    documentService.connect(client);
  }

  @Override
  public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
    LOG.info("Initializing server");

    String rootUri = rootUri(params);
    if (rootUri != null) {
      // We ensure there is a trailing slash so the root URI gets treated as a directory.
      URI workspaceRootUri = URI.create(rootUri.replaceAll("([^/])$", "$1/"));
      workspaceService.setWorkspaceRoot(workspaceRootUri);
    }

    ServerCapabilities capabilities = new ServerCapabilities();
    capabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
    capabilities.setFoldingRangeProvider(true);
    capabilities.setHoverProvider(true);
    capabilities.setDefinitionProvider(true);
    capabilities.setDocumentSymbolProvider(true);

    return CompletableFuture.completedFuture(
        new InitializeResult(capabilities, new ServerInfo("cmake-language-server")));
  }

  @Override
  public void initialized(InitializedParams params) {
    LOG.info("initialized()");
    workspaceService.initialized();
  }

  @Override
  public CompletableFuture<Object> shutdown() {
    LOG.info("Shutting down");
    documentService.shutdown();
    return CompletableFuture.completedFuture(null);
  }

  @Override
  public void exit() {}

  /** The root of the workspace, preferring the first workspace folder over the older rootUri. */
  @SuppressWarnings("deprecation")
  private static String rootUri(InitializeParams params) {
    if (params.getWorkspaceFolders() != null && !params.getWorkspaceFolders().isEmpty()) {
      WorkspaceFolder folder = params.getWorkspaceFolders().get(0);
      return folder.getUri();
    }
    return params.getRootUri();
  }
}
