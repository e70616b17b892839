package com.automate.CodeAudit.utilities;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipException;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ArchiveUtilTest {

    @TempDir
    Path tmp;

    private Path zip(String name, Map<String, String> entries) throws IOException {
        Path zipPath = tmp.resolve(name);
        try (OutputStream out = Files.newOutputStream(zipPath);
             ZipOutputStream zos = new ZipOutputStream(out)) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(e.getKey()));
                zos.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        }
        return zipPath;
    }

    @Test
    void validZipIsAccepted() throws IOException {
        Path zipPath = zip("ok.zip", Map.of("src/app.py", "print('hello')\n"));

        ArchiveUtil.ArchiveCheck check = ArchiveUtil.checkZipFile(zipPath);

        assertThat(check.valid()).isTrue();
        assertThat(check.error()).isNull();
    }

    @Test
    void notAZipIsInvalid() throws IOException {
        Path file = tmp.resolve("notes.zip");
        Files.writeString(file, "definitely not a zip archive");

        ArchiveUtil.ArchiveCheck check = ArchiveUtil.checkZipFile(file);

        assertThat(check.valid()).isFalse();
        assertThat(check.error()).isEqualTo(ArchiveUtil.INVALID_ZIP);
    }

    @Test
    void entryWithEncryptionFlagIsRejected() throws IOException {
        Path zipPath = zip("secret.zip", Map.of("a.txt", "aaa"));
        byte[] bytes = Files.readAllBytes(zipPath);
        // set bit 0 of the general purpose flag in the central directory header
        for (int i = 0; i + 8 < bytes.length; i++) {
            if (bytes[i] == 0x50 && bytes[i + 1] == 0x4b && bytes[i + 2] == 0x01 && bytes[i + 3] == 0x02) {
                bytes[i + 8] |= 0x01;
            }
        }
        Files.write(zipPath, bytes);

        ArchiveUtil.ArchiveCheck check = ArchiveUtil.checkZipFile(zipPath);

        assertThat(check.valid()).isFalse();
        assertThat(check.error()).isEqualTo(ArchiveUtil.ENCRYPTED_ZIP);
    }

    @Test
    void sha256OfKnownContent() throws IOException {
        Path file = tmp.resolve("abc.txt");
        Files.writeString(file, "abc");

        assertThat(ArchiveUtil.sha256sum(file))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void sha256OfEmptyAndMultiBlockFiles() throws IOException {
        Path file = tmp.resolve("empty.bin");
        Files.write(file, new byte[0]);

        assertThat(ArchiveUtil.sha256sum(file))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");

        Path big = tmp.resolve("big.bin");
        Files.write(big, new byte[10_000]);
        assertThat(ArchiveUtil.sha256sum(big)).hasSize(64).isNotEqualTo(ArchiveUtil.sha256sum(file));
    }

    @Test
    void extractWritesEveryFile() throws IOException {
        Path zipPath = zip("src.zip", Map.of(
                "src/main.py", "import os\n",
                "README.md", "# readme\n"));
        Path target = tmp.resolve("extract");

        int count = ArchiveUtil.extract(zipPath, target);

        assertThat(count).isEqualTo(2);
        assertThat(Files.readString(target.resolve("src/main.py"))).isEqualTo("import os\n");
        assertThat(target.resolve("README.md")).exists();
    }

    @Test
    void extractRejectsEntriesOutsideTarget() throws IOException {
        Path zipPath = zip("slip.zip", Map.of("../evil.sh", "rm -rf /"));

        assertThatThrownBy(() -> ArchiveUtil.extract(zipPath, tmp.resolve("extract")))
                .isInstanceOf(ZipException.class);
        assertThat(tmp.resolve("evil.sh")).doesNotExist();
    }
}
