package com.automate.CodeAudit.utilities;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Enumeration;
import java.util.HexFormat;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipFile;

/**
 * Zip archive helpers used on project upload: validation, fingerprint and
 * extraction.
 */
public final class ArchiveUtil {

    private ArchiveUtil() {}

    public static final String INVALID_ZIP = "invalid zip file";
    public static final String ENCRYPTED_ZIP = "encrypted zip file";

    private static final int BLOCK_SIZE = 4096;

    private static final int EOCD_SIG = 0x06054b50;
    private static final int EOCD_SIZE = 22;
    private static final int ZIP64_LOCATOR_SIG = 0x07064b50;
    private static final int ZIP64_LOCATOR_SIZE = 20;
    private static final int ZIP64_EOCD_SIG = 0x06064b50;
    private static final int CEN_SIG = 0x02014b50;
    private static final int CEN_HEADER_SIZE = 46;
    private static final int MAX_COMMENT = 0xFFFF;
    private static final int FLAG_ENCRYPTED = 0x1;

    public record ArchiveCheck(boolean valid, String error) {
        static ArchiveCheck ok() { return new ArchiveCheck(true, null); }
        static ArchiveCheck rejected(String error) { return new ArchiveCheck(false, error); }
    }

    /**
     * Checks that the file is a well-formed zip archive and that no entry has
     * the encryption bit of its general purpose flag set.
     */
    public static ArchiveCheck checkZipFile(Path zipPath) {
        try (ZipFile ignored = new ZipFile(zipPath.toFile())) {
            // opening reads the central directory, which is what "well-formed" means here
        } catch (IOException e) {
            return ArchiveCheck.rejected(INVALID_ZIP);
        }
        try {
            return hasEncryptedEntry(zipPath)
                    ? ArchiveCheck.rejected(ENCRYPTED_ZIP)
                    : ArchiveCheck.ok();
        } catch (IOException e) {
            return ArchiveCheck.rejected(INVALID_ZIP);
        }
    }

    /** Hex encoded SHA-256 of the file, read block by block. */
    public static String sha256sum(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        byte[] block = new byte[BLOCK_SIZE];
        try (InputStream in = Files.newInputStream(file)) {
            int read;
            while ((read = in.read(block)) != -1) {
                digest.update(block, 0, read);
            }
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    /**
     * Extracts every entry under {@code targetDir}. Entries resolving outside
     * of the target directory abort the extraction.
     *
     * @return number of extracted files
     */
    public static int extract(Path zipPath, Path targetDir) throws IOException {
        Path root = targetDir.toAbsolutePath().normalize();
        Files.createDirectories(root);
        int count = 0;
        try (ZipFile zip = new ZipFile(zipPath.toFile())) {
            Enumeration<? extends ZipEntry> entries = zip.entries();
            while (entries.hasMoreElements()) {
                ZipEntry entry = entries.nextElement();
                Path out = root.resolve(entry.getName()).normalize();
                if (!out.startsWith(root)) {
                    throw new ZipException("Entry is outside of the target dir: " + entry.getName());
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                    continue;
                }
                Files.createDirectories(out.getParent());
                try (InputStream in = zip.getInputStream(entry)) {
                    Files.copy(in, out, StandardCopyOption.REPLACE_EXISTING);
                }
                count++;
            }
        }
        return count;
    }

    // ---------- Central directory scan ----------

    private static boolean hasEncryptedEntry(Path zipPath) throws IOException {
        try (FileChannel ch = FileChannel.open(zipPath, StandardOpenOption.READ)) {
            long size = ch.size();
            long eocdPos = findEndOfCentralDirectory(ch, size);
            ByteBuffer eocd = read(ch, eocdPos, EOCD_SIZE);

            long entries = eocd.getShort(10) & 0xFFFF;
            long cenSize = eocd.getInt(12) & 0xFFFFFFFFL;
            long cenEnd = eocdPos;

            if (eocdPos >= ZIP64_LOCATOR_SIZE
                    && read(ch, eocdPos - ZIP64_LOCATOR_SIZE, 4).getInt(0) == ZIP64_LOCATOR_SIG) {
                long zip64EocdPos = read(ch, eocdPos - ZIP64_LOCATOR_SIZE, ZIP64_LOCATOR_SIZE).getLong(8);
                ByteBuffer zip64 = read(ch, zip64EocdPos, 56);
                if (zip64.getInt(0) != ZIP64_EOCD_SIG) {
                    throw new ZipException("Bad zip64 end of central directory");
                }
                entries = zip64.getLong(32);
                cenSize = zip64.getLong(40);
                cenEnd = zip64EocdPos;
            }

            long cenStart = cenEnd - cenSize;
            if (cenStart < 0 || cenSize > Integer.MAX_VALUE) {
                throw new ZipException("Bad central directory size");
            }
            ByteBuffer cen = read(ch, cenStart, (int) cenSize);
            int pos = 0;
            for (long i = 0; i < entries; i++) {
                if (pos + CEN_HEADER_SIZE > cen.limit() || cen.getInt(pos) != CEN_SIG) {
                    throw new ZipException("Bad central directory header");
                }
                int flag = cen.getShort(pos + 8) & 0xFFFF;
                if ((flag & FLAG_ENCRYPTED) != 0) {
                    return true;
                }
                int nameLen = cen.getShort(pos + 28) & 0xFFFF;
                int extraLen = cen.getShort(pos + 30) & 0xFFFF;
                int commentLen = cen.getShort(pos + 32) & 0xFFFF;
                pos += CEN_HEADER_SIZE + nameLen + extraLen + commentLen;
            }
            return false;
        }
    }

    private static long findEndOfCentralDirectory(FileChannel ch, long size) throws IOException {
        if (size < EOCD_SIZE) {
            throw new ZipException("File too small to be a zip archive");
        }
        long from = Math.max(0, size - EOCD_SIZE - MAX_COMMENT);
        ByteBuffer tail = read(ch, from, (int) (size - from));
        for (int i = tail.limit() - EOCD_SIZE; i >= 0; i--) {
            if (tail.getInt(i) == EOCD_SIG) {
                return from + i;
            }
        }
        throw new ZipException("End of central directory not found");
    }

    private static ByteBuffer read(FileChannel ch, long position, int length) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(length).order(ByteOrder.LITTLE_ENDIAN);
        while (buf.hasRemaining()) {
            if (ch.read(buf, position + buf.position()) < 0) {
                throw new ZipException("Unexpected end of zip file");
            }
        }
        return buf.flip();
    }
}
