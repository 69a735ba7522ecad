// file: server/src/main/java/io/monosync/server/Main.java
package io.monosync.server;

import io.monosync.server.check.ChangesetChecker;
import io.monosync.server.derived.AltHashDeriver;
import io.monosync.server.derived.ManifestDeriver;
import io.monosync.server.diff.ChangesetDiffer;
import io.monosync.server.identity.IdentifierResolver;
import io.monosync.server.identity.LegacyRevisionAssigner;
import io.monosync.server.identity.Schemes;
import io.monosync.server.repo.RepoConfig;
import io.monosync.server.repo.RepoRegistry;
import io.monosync.server.repo.Storage;
import io.monosync.server.sync.PushRedirector;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for a monosync server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load the repository / sync-pair config.
 *  - Wire storage (one WAL per store), derived data, identifier schemes,
 *    the push redirector, differ and checker.
 *  - Finish any bookmark backsync a crash interrupted.
 *  - Start the HTTP server and close stores on shutdown.
 */
public final class Main {
    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        configureLogging();
        var cfg = ServerConfig.fromArgs(args);

        RepoConfig repoConfig = cfg.repoConfigPath() != null && !cfg.repoConfigPath().isBlank()
                ? RepoConfig.fromJsonFile(Path.of(cfg.repoConfigPath()))
                : RepoConfig.defaults();

        // ------ Storage ------
        Storage storage = cfg.inMemory() ? Storage.inMemory() : Storage.durable(Path.of(cfg.dataDir()));
        var registry = new RepoRegistry(repoConfig, storage);

        // ------ Derived data + identifiers ------
        var manifests = new ManifestDeriver();
        var altHashes = new AltHashDeriver(manifests);
        var resolver = new IdentifierResolver(Schemes.all(altHashes));
        var legacyRevisions = new LegacyRevisionAssigner();

        // ------ Sync engine ------
        var redirector = new PushRedirector(registry, legacyRevisions, altHashes);
        redirector.recover();

        var service = new RepoService(registry, resolver, redirector,
                new ChangesetDiffer(manifests), new ChangesetChecker(registry));
        var web = new WebServer(cfg.httpPort(), service);
        web.start();

        LOG.info(String.format("monosync listening on http://localhost:%d (%s)", cfg.httpPort(),
                cfg.inMemory() ? "in-memory" : "data in " + cfg.dataDir()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                web.stop();
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "failed to stop HTTP server", e);
            }
            registry.close();
        }));
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }
}
