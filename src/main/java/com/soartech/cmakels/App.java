package com.soartech.cmakels;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.launch.LSPLauncher;
import org.eclipse.lsp4j.services.LanguageClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
  private static final Logger LOG = LoggerFactory.getLogger(App.class);

  public static void main(String[] args) {
    Server server = new Server();
    Launcher<LanguageClient> launcher =
        LSPLauncher.createServerLauncher(
            server, exitOnClose(System.in), System.out, false, new PrintWriter(System.err));
    server.connect(launcher.getRemoteProxy());
    LOG.info("Listening on standard input");
    launcher.startListening();
  }

  /**
   * Wrap an InputStream such that the process will exit when the stream closes. Some clients detach
   * the language server process when they shut down instead of killing it.
   */
  static InputStream exitOnClose(InputStream delegate) {
    return new InputStream() {
      @Override
      public int read() throws IOException {
        return exitIfNegative(delegate.read());
      }

      @Override
      public int read(byte[] buffer, int offset, int length) throws IOException {
        return exitIfNegative(delegate.read(buffer, offset, length));
      }

      int exitIfNegative(int result) {
        if (result < 0) {
          LOG.info("Standard input has closed; exiting");
          System.exit(0);
        }
        return result;
      }
    };
  }
}
