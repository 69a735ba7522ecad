// file: server/src/main/java/io/monosync/server/ServerConfig.java
package io.monosync.server;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:       HTTP API port
 *  - dataDir:        directory holding every store's write-ahead log
 *  - repoConfigPath: optional JSON file describing repositories and sync pairs
 *  - inMemory:       keep everything in memory (nothing survives a restart)
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        String repoConfigPath,
        boolean inMemory
) {

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --config,    -c   <path>
     *   --in-memory
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local dev.
     */
    public static ServerConfig fromArgs(String[] args) {
        int httpPort = 8080;
        String dataDir = "./data";
        String repoConfigPath = null;
        boolean inMemory = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    try {
                        httpPort = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        System.err.println("Invalid http-port: " + args[i]);
                        System.exit(1);
                    }
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    repoConfigPath = args[++i];
                }

                case "--in-memory" -> inMemory = true;

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        return new ServerConfig(httpPort, dataDir, repoConfigPath, inMemory);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port, -p   HTTP port (default: 8080)
              --data-dir,  -d   Directory for write-ahead logs (default: ./data)
              --config,    -c   Path to JSON repository/sync config (optional;
                                default: repos "large" (0) and "small" (1),
                                small embedded under "small/")
              --in-memory       Keep all state in memory
              --help,      -h   Show this help message
            """);
        System.exit(0);
    }
}
