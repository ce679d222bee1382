package archive.ingest.util;

import archive.ingest.common.ChecksumAccumulator;
import archive.ingest.common.ChecksumAlgorithm;

import java.security.MessageDigest;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Factory for {@link ChecksumAccumulator}s.
 */
public final class Checksums {

    public static ChecksumAccumulator newAccumulator(ChecksumAlgorithm algorithm) {
        switch (Objects.requireNonNull(algorithm)) {
            case CRC32:
                return new Crc32Accumulator();
            case MD5:
                return new DigestAccumulator(algorithm, "MD5");
            default:
                throw new IllegalArgumentException("Unsupported checksum algorithm: " + algorithm);
        }
    }

    private static final class Crc32Accumulator implements ChecksumAccumulator {
        private final CRC32 crc = new CRC32();
        private long byteCount;

        @Override
        public ChecksumAlgorithm getAlgorithm() {
            return ChecksumAlgorithm.CRC32;
        }

        @Override
        public void update(byte[] buffer, int offset, int length) {
            crc.update(buffer, offset, length);
            byteCount += length;
        }

        @Override
        public void update(int b) {
            crc.update(b);
            byteCount++;
        }

        @Override
        public long getByteCount() {
            return byteCount;
        }

        @Override
        public String getValue() {
            return Long.toString(crc.getValue());
        }
    }

    private static final class DigestAccumulator implements ChecksumAccumulator {
        private final ChecksumAlgorithm algorithm;
        private final MessageDigest digest;
        private long byteCount;

        DigestAccumulator(ChecksumAlgorithm algorithm, String digestName) {
            this.algorithm = algorithm;
            this.digest = DigestHelper.newDigest(digestName);
        }

        @Override
        public ChecksumAlgorithm getAlgorithm() {
            return algorithm;
        }

        @Override
        public void update(byte[] buffer, int offset, int length) {
            digest.update(buffer, offset, length);
            byteCount += length;
        }

        @Override
        public void update(int b) {
            digest.update((byte) b);
            byteCount++;
        }

        @Override
        public long getByteCount() {
            return byteCount;
        }

        @Override
        public String getValue() {
            // digest() resets, so work on a copy to allow further updates
            try {
                return DigestHelper.toHexString(((MessageDigest) digest.clone()).digest());
            } catch (CloneNotSupportedException e) {
                throw new IllegalStateException("Digest " + digest.getAlgorithm() + " cannot be cloned", e);
            }
        }
    }

    // Utility class
    private Checksums() {}
}
