package com.reportpull.auth.store;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.reportpull.auth.TokenExchanger;
import com.reportpull.auth.TokenRecord;

import lombok.extern.slf4j.Slf4j;

/**
 * Owner-only token file, one per service: access token, refresh token, instance URL,
 * expiry and issue time on consecutive lines. Empty lines stand for absent values.
 */
@Slf4j
public class TokenFileStore {

    static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    static final Set<PosixFilePermission> OWNER_ONLY_DIRECTORY = PosixFilePermissions.fromString("rwx------");

    private final Path directory;

    public TokenFileStore(Path directory) {
        this.directory = directory;
    }

    public static TokenFileStore inUserConfig(String applicationName) {
        return new TokenFileStore(Path.of(System.getProperty("user.home"), ".config", applicationName));
    }

    public Path fileFor(String serviceId) {
        return directory.resolve(serviceId + ".tokens");
    }

    public Optional<TokenRecord> read(String serviceId) throws IOException {
        Path file = fileFor(serviceId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.size() < 4 || lines.get(0).isBlank() || lines.get(3).isBlank()) {
            log.warn("Token file {} is incomplete, ignoring it", file);
            return Optional.empty();
        }
        try {
            Instant expiresAt = parseInstant(lines.get(3));
            Instant issuedAt = lines.size() > 4 && !lines.get(4).isBlank()
                ? parseInstant(lines.get(4))
                : expiresAt.minusSeconds(TokenExchanger.DEFAULT_EXPIRES_IN_SECONDS);
            return Optional.of(new TokenRecord(
                lines.get(0).trim(),
                emptyToNull(lines.get(1)),
                emptyToNull(lines.get(2)),
                issuedAt,
                expiresAt));
        } catch (DateTimeParseException | NumberFormatException e) {
            log.warn("Token file {} has an unreadable timestamp: {}", file, e.getMessage());
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            log.warn("Token file {} is inconsistent: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Writes through an owner-only temp file that atomically replaces the previous one.
     * A failed write leaves no temp file behind.
     */
    public void write(String serviceId, TokenRecord record) throws IOException {
        boolean posix = supportsPosix();
        if (!Files.isDirectory(directory)) {
            if (posix) {
                Files.createDirectories(directory, PosixFilePermissions.asFileAttribute(OWNER_ONLY_DIRECTORY));
            } else {
                Files.createDirectories(directory);
            }
        }
        Path file = fileFor(serviceId);
        Path tmp = directory.resolve(serviceId + ".tokens.tmp");
        String content = String.join("\n",
            record.accessToken(),
            nullToEmpty(record.refreshToken()),
            nullToEmpty(record.instanceUrl()),
            record.expiresAt().toString(),
            record.issuedAt().toString());
        try {
            Files.deleteIfExists(tmp);
            if (posix) {
                Files.createFile(tmp, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                Files.createFile(tmp);
            }
            Files.writeString(tmp, content, StandardCharsets.UTF_8,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException | RuntimeException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
        log.debug("Wrote token file {}", file);
    }

    public boolean delete(String serviceId) throws IOException {
        return Files.deleteIfExists(fileFor(serviceId));
    }

    /**
     * ISO-8601 as written by this store, or epoch seconds (possibly fractional) from older files.
     */
    static Instant parseInstant(String raw) {
        String value = raw.trim();
        if (!value.isEmpty() && (Character.isDigit(value.charAt(0)) && value.indexOf('T') < 0)) {
            BigDecimal seconds = new BigDecimal(value);
            return Instant.ofEpochSecond(seconds.longValue(),
                seconds.remainder(BigDecimal.ONE).movePointRight(9).intValue());
        }
        return Instant.parse(value);
    }

    private boolean supportsPosix() {
        return directory.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    private static String emptyToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
