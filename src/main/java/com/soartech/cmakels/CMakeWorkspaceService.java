package com.soartech.cmakels;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.Supplier;
import org.eclipse.lsp4j.Diagnostic;
import org.eclipse.lsp4j.DiagnosticSeverity;
import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesRegistrationOptions;
import org.eclipse.lsp4j.FileEvent;
import org.eclipse.lsp4j.FileSystemWatcher;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.PublishDiagnosticsParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.Registration;
import org.eclipse.lsp4j.RegistrationParams;
import org.eclipse.lsp4j.jsonrpc.messages.Either;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class CMakeWorkspaceService implements WorkspaceService {

  private static final Logger LOG = LoggerFactory.getLogger(CMakeWorkspaceService.class);

  static final String MANIFEST_FILE = "cmakels.json";

  /** The key under which clients send this server's settings. */
  static final String SETTINGS_KEY = "cmake";

  private LanguageClient client = null;

  private final CMakeDocumentService documentService;
  private URI workspaceRootUri = null;

  CMakeWorkspaceService(CMakeDocumentService documentService) {
    this.documentService = documentService;
  }

  public void connect(LanguageClient client) {
    this.client = client;
  }

  void setWorkspaceRoot(URI workspaceRootUri) {
    this.workspaceRootUri = workspaceRootUri;
  }

  void initialized() {
    // Here we register for changes to the manifest file, so that we trigger a new analysis when
    // the project configuration changes.
    FileSystemWatcher watcher = new FileSystemWatcher(Either.forLeft("**/" + MANIFEST_FILE));
    List<FileSystemWatcher> watchers = Arrays.asList(watcher);
    DidChangeWatchedFilesRegistrationOptions options =
        new DidChangeWatchedFilesRegistrationOptions(watchers);
    Registration registration =
        new Registration("changes", "workspace/didChangeWatchedFiles", options);
    List<Registration> registrations = Arrays.asList(registration);
    client.registerCapability(new RegistrationParams(registrations));

    processManifest();
  }

  /**
   * Read the manifest file at the workspace root and hand it to the document service. A missing
   * manifest means the defaults are used. Problems with the file are published as diagnostics on
   * it.
   */
  public void processManifest() {
    if (workspaceRootUri == null) {
      LOG.info("No workspace root; using the default project configuration");
      return;
    }
    LOG.info("Processing manifest: workspace path: {}", workspaceRootUri);

    Function<String, Diagnostic> makeError =
        message ->
            new Diagnostic(
                new Range(new Position(0, 0), new Position(0, 0)),
                message,
                DiagnosticSeverity.Error,
                "workspace service");

    Supplier<List<Diagnostic>> readManifest =
        () -> {
          Path manifestPath = Paths.get(manifestUri());

          if (!Files.exists(manifestPath)) {
            LOG.info("Not found: {} -- using the default project configuration", manifestPath);
            documentService.setProjectConfig(new ProjectConfiguration());
            return new ArrayList<>();
          }

          String manifestJson;
          try {
            manifestJson = new String(Files.readAllBytes(manifestPath), StandardCharsets.UTF_8);
          } catch (IOException e) {
            LOG.error("Failed to read {}", manifestPath, e);
            return Arrays.asList(makeError.apply("Failed to read file"));
          }

          try {
            ProjectConfiguration configuration =
                new Gson().fromJson(manifestJson, ProjectConfiguration.class);
            if (configuration == null) {
              // The file is empty.
              configuration = new ProjectConfiguration();
            }
            documentService.setProjectConfig(configuration);
          } catch (JsonParseException e) {
            LOG.error("Error trying to read {}", manifestPath, e);
            return Arrays.asList(makeError.apply(e.getMessage()));
          }

          // On success, there are no diagnostics
          return new ArrayList<>();
        };

    List<Diagnostic> diagnostics = readManifest.get();
    client.publishDiagnostics(new PublishDiagnosticsParams(manifestUri().toString(), diagnostics));
  }

  @Override
  public void didChangeConfiguration(DidChangeConfigurationParams params) {
    if (!(params.getSettings() instanceof JsonObject)) {
      LOG.warn("Ignoring settings that are not a JSON object: {}", params.getSettings());
      return;
    }
    JsonObject settings = (JsonObject) params.getSettings();
    JsonElement cmakeSettings = settings.get(SETTINGS_KEY);
    if (cmakeSettings == null) {
      return;
    }
    Configuration config = new Gson().fromJson(cmakeSettings, Configuration.class);
    documentService.setConfiguration(config);
  }

  @Override
  public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
    if (workspaceRootUri == null) {
      return;
    }
    for (FileEvent change : params.getChanges()) {
      if (CMakeDocumentService.uri(change.getUri()).equals(manifestUri())) {
        processManifest();
      }
    }
  }

  /** Returns the URI of the project configuration file. */
  URI manifestUri() {
    return workspaceRootUri.resolve(MANIFEST_FILE);
  }
}
