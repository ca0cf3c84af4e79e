package settingsd.io;

import settingsd.ConfigParseException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

public final class AtomicFiles {

    public static final Set<PosixFilePermission> DEFAULT_PERMISSIONS = PosixFilePermissions.fromString("rw-r--r--");

    private AtomicFiles() {
    }

    public static Optional<byte[]> read(Path path) throws IOException {
        if (path == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        }
    }

    public static Optional<String> readText(Path path) throws IOException {
        Optional<byte[]> data = read(path);
        if (data.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(decodeUtf8(path, data.get()));
    }

    /**
     * Strict decode: malformed input is reported at its byte offset, never replaced.
     */
    public static String decodeUtf8(Path path, byte[] data) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        ByteBuffer in = ByteBuffer.wrap(data);
        CharBuffer out = CharBuffer.allocate(data.length);
        CoderResult result = decoder.decode(in, out, true);
        if (!result.isError()) {
            result = decoder.flush(out);
        }
        if (result.isError()) {
            throw ConfigParseException.atOffset(path, in.position(), "invalid UTF-8 sequence");
        }
        out.flip();
        return out.toString();
    }

    public static void writeAtomic(Path path, byte[] data) throws IOException {
        writeAtomic(path, data, null);
    }

    public static void writeAtomic(Path path, byte[] data, Set<PosixFilePermission> permissions) throws IOException {
        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Set<PosixFilePermission> mode = permissions == null ? existingPermissions(target) : permissions;

        Path tmp = Files.createTempFile(dir, target.getFileName() + ".", ".tmp");
        try {
            applyPermissions(tmp, mode);
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buffer = ByteBuffer.wrap(data == null ? new byte[0] : data);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException | RuntimeException ex) {
            deleteQuietly(tmp, ex);
            throw ex;
        }
    }

    private static Set<PosixFilePermission> existingPermissions(Path target) throws IOException {
        if (!Files.isRegularFile(target) || !isPosix(target)) {
            return DEFAULT_PERMISSIONS;
        }
        return Files.getPosixFilePermissions(target);
    }

    private static void applyPermissions(Path tmp, Set<PosixFilePermission> mode) throws IOException {
        if (isPosix(tmp)) {
            Files.setPosixFilePermissions(tmp, mode);
        }
    }

    private static boolean isPosix(Path path) throws IOException {
        return Files.getFileStore(path).supportsFileAttributeView(PosixFileAttributeView.class);
    }

    private static void deleteQuietly(Path tmp, Exception cause) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException ex) {
            cause.addSuppressed(ex);
        }
    }
}
