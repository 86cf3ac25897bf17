// SPDX-License-Identifier: Apache-2.0
package org.hiero.harness.rpc;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * User name and password accepted by a node's RPC server.
 *
 * @param user     the RPC user
 * @param password the RPC password
 */
public record RpcCredentials(@NonNull String user, @NonNull String password) {

    public static final String DEFAULT_CONFIG_FILE = "magnachain.conf";
    private static final String USER_PREFIX = "rpcuser=";
    private static final String PASSWORD_PREFIX = "rpcpassword=";

    public RpcCredentials {
        requireNonNull(user, "user must not be null");
        requireNonNull(password, "password must not be null");
    }

    /**
     * Reads the credentials of the node owning the given data directory, using the default configuration file name.
     *
     * @param dataDir the node's data directory
     * @return the credentials
     * @see #fromDataDir(Path, String)
     */
    @NonNull
    public static RpcCredentials fromDataDir(@NonNull final Path dataDir) {
        return fromDataDir(dataDir, DEFAULT_CONFIG_FILE);
    }

    /**
     * Reads the credentials of the node owning the given data directory.
     *
     * <p>The {@code rpcuser=} and {@code rpcpassword=} lines of the configuration file are read first. A
     * {@code regtest/.cookie} file of the form {@code user:password} overrides them.
     *
     * @param dataDir        the node's data directory
     * @param configFileName the name of the node's configuration file inside the data directory
     * @return the credentials
     * @throws IllegalStateException if the configuration file repeats a credential line, or neither source yields both
     *                               values
     */
    @NonNull
    public static RpcCredentials fromDataDir(@NonNull final Path dataDir, @NonNull final String configFileName) {
        requireNonNull(dataDir);
        requireNonNull(configFileName);
        String user = null;
        String password = null;
        final Path configFile = dataDir.resolve(configFileName);
        if (Files.isRegularFile(configFile)) {
            for (final String line : readLines(configFile)) {
                if (line.startsWith(USER_PREFIX)) {
                    user = single(user, USER_PREFIX, line, configFile);
                } else if (line.startsWith(PASSWORD_PREFIX)) {
                    password = single(password, PASSWORD_PREFIX, line, configFile);
                }
            }
        }
        final Path cookieFile = dataDir.resolve("regtest").resolve(".cookie");
        if (Files.isRegularFile(cookieFile)) {
            final String cookie = String.join("", readLines(cookieFile));
            final int separator = cookie.indexOf(':');
            if (separator < 0) {
                throw new IllegalStateException("Malformed cookie file " + cookieFile);
            }
            user = cookie.substring(0, separator);
            password = cookie.substring(separator + 1);
        }
        if (user == null || password == null) {
            throw new IllegalStateException("No RPC credentials");
        }
        return new RpcCredentials(user, password);
    }

    @NonNull
    private static String single(
            @Nullable final String previous,
            @NonNull final String prefix,
            @NonNull final String line,
            @NonNull final Path file) {
        if (previous != null) {
            throw new IllegalStateException("Duplicate %s line in %s".formatted(prefix, file));
        }
        return line.substring(prefix.length());
    }

    @NonNull
    private static List<String> readLines(@NonNull final Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException("Unable to read " + file, e);
        }
    }

    @Override
    public String toString() {
        return "RpcCredentials{user=" + user + "}";
    }
}
