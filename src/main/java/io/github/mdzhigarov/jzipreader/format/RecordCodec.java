/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipreader.format;

import io.github.mdzhigarov.jzipreader.FieldTooLongException;
import io.github.mdzhigarov.jzipreader.InvalidSignatureException;
import io.github.mdzhigarov.jzipreader.NonUtf8FieldException;
import io.github.mdzhigarov.jzipreader.source.SeekableSource;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes and encodes the ZIP records this reader understands. Decoding starts at the source's
 * current position and leaves it right after the record; encoding writes the exact bytes
 * decoding consumes, so {@code decode(encode(r))} reproduces {@code r}.
 *
 * <p>All integers are little-endian. Variable-length fields follow the fixed part in the
 * order name, extra field, comment. Names and comments must be valid UTF-8; extra fields are
 * passed through untouched.
 */
public final class RecordCodec {

    private static final Logger logger = LoggerFactory.getLogger(RecordCodec.class);

    private static final int SIGNATURE_SIZE = 4;

    private RecordCodec() {
    }

    public static LocalFileHeader decodeLocalFileHeader(SeekableSource in) throws IOException {
        long offset = in.position();
        ByteBuffer buffer = readRecord(in, LocalFileHeader.SIGNATURE, LocalFileHeader.FIXED_SIZE, offset);

        int versionNeeded = readU16(buffer);
        GeneralPurposeFlags flags = GeneralPurposeFlags.of(readU16(buffer));
        int compressionMethod = readU16(buffer);
        DosDateTime lastModified = readDateTime(buffer);
        long crc32 = readU32(buffer);
        long compressedSize = readU32(buffer);
        long uncompressedSize = readU32(buffer);
        int fileNameLength = readU16(buffer);
        int extraFieldLength = readU16(buffer);

        LocalFileHeader header = LocalFileHeader.newBuilder()
            .versionNeededToExtract(versionNeeded)
            .flags(flags)
            .compressionMethod(compressionMethod)
            .lastModified(lastModified)
            .crc32(crc32)
            .compressedSize(compressedSize)
            .uncompressedSize(uncompressedSize)
            .fileName(readText(in, fileNameLength, "file name"))
            .extraField(readBytes(in, extraFieldLength))
            .build();

        logger.debug("Local header at {}: {}", offset, header);

        flags.checkSupported();
        return header;
    }

    public static CentralDirectoryHeader decodeCentralDirectoryHeader(SeekableSource in) throws IOException {
        long offset = in.position();
        ByteBuffer buffer = readRecord(in, CentralDirectoryHeader.SIGNATURE, CentralDirectoryHeader.FIXED_SIZE, offset);

        int versionMadeBy = readU16(buffer);
        int versionNeeded = readU16(buffer);
        int flags = readU16(buffer);
        int compressionMethod = readU16(buffer);
        DosDateTime lastModified = readDateTime(buffer);
        long crc32 = readU32(buffer);
        long compressedSize = readU32(buffer);
        long uncompressedSize = readU32(buffer);
        int fileNameLength = readU16(buffer);
        int extraFieldLength = readU16(buffer);
        int fileCommentLength = readU16(buffer);
        int diskNumberStart = readU16(buffer);
        int internalAttributes = readU16(buffer);
        long externalAttributes = readU32(buffer);
        long localHeaderOffset = readU32(buffer);

        CentralDirectoryHeader header = CentralDirectoryHeader.newBuilder()
            .versionMadeBy(versionMadeBy)
            .versionNeededToExtract(versionNeeded)
            .flags(flags)
            .compressionMethod(compressionMethod)
            .lastModified(lastModified)
            .crc32(crc32)
            .compressedSize(compressedSize)
            .uncompressedSize(uncompressedSize)
            .diskNumberStart(diskNumberStart)
            .internalAttributes(internalAttributes)
            .externalAttributes(externalAttributes)
            .localHeaderOffset(localHeaderOffset)
            .fileName(readText(in, fileNameLength, "file name"))
            .extraField(readBytes(in, extraFieldLength))
            .fileComment(readText(in, fileCommentLength, "file comment"))
            .build();

        logger.debug("Central directory header at {}: {}", offset, header);
        return header;
    }

    public static EndOfCentralDirectoryRecord decodeEndOfCentralDirectory(SeekableSource in) throws IOException {
        long offset = in.position();
        ByteBuffer buffer = readRecord(in, EndOfCentralDirectoryRecord.SIGNATURE,
                EndOfCentralDirectoryRecord.FIXED_SIZE, offset);

        EndOfCentralDirectoryRecord.Builder builder = EndOfCentralDirectoryRecord.newBuilder()
            .diskNumber(readU16(buffer))
            .centralDirectoryDisk(readU16(buffer))
            .entriesOnDisk(readU16(buffer))
            .totalEntries(readU16(buffer))
            .centralDirectorySize(readU32(buffer))
            .centralDirectoryOffset(readU32(buffer));
        int commentLength = readU16(buffer);

        EndOfCentralDirectoryRecord record = builder
            .comment(readText(in, commentLength, "archive comment"))
            .build();

        logger.debug("End of central directory at {}: {}", offset, record);
        return record;
    }

    public static void encode(LocalFileHeader header, OutputStream out) throws IOException {
        checkLength("file name", header.fileNameBytes());
        checkLength("extra field", header.extraFieldBytes());

        ByteBuffer buffer = newBuffer(LocalFileHeader.FIXED_SIZE);
        writeU32(buffer, LocalFileHeader.SIGNATURE);
        writeU16(buffer, header.getVersionNeededToExtract());
        writeU16(buffer, header.getFlags().getValue());
        writeU16(buffer, header.getCompressionMethod());
        writeDateTime(buffer, header.getLastModified());
        writeU32(buffer, header.getCrc32());
        writeU32(buffer, header.getCompressedSize());
        writeU32(buffer, header.getUncompressedSize());
        writeU16(buffer, header.getFileNameLength());
        writeU16(buffer, header.getExtraFieldLength());

        out.write(buffer.array());
        out.write(header.fileNameBytes());
        out.write(header.extraFieldBytes());
    }

    public static void encode(CentralDirectoryHeader header, OutputStream out) throws IOException {
        checkLength("file name", header.fileNameBytes());
        checkLength("extra field", header.extraFieldBytes());
        checkLength("file comment", header.fileCommentBytes());

        ByteBuffer buffer = newBuffer(CentralDirectoryHeader.FIXED_SIZE);
        writeU32(buffer, CentralDirectoryHeader.SIGNATURE);
        writeU16(buffer, header.getVersionMadeBy());
        writeU16(buffer, header.getVersionNeededToExtract());
        writeU16(buffer, header.getFlags().getValue());
        writeU16(buffer, header.getCompressionMethod());
        writeDateTime(buffer, header.getLastModified());
        writeU32(buffer, header.getCrc32());
        writeU32(buffer, header.getCompressedSize());
        writeU32(buffer, header.getUncompressedSize());
        writeU16(buffer, header.getFileNameLength());
        writeU16(buffer, header.getExtraFieldLength());
        writeU16(buffer, header.getFileCommentLength());
        writeU16(buffer, header.getDiskNumberStart());
        writeU16(buffer, header.getInternalAttributes());
        writeU32(buffer, header.getExternalAttributes());
        writeU32(buffer, header.getLocalHeaderOffset());

        out.write(buffer.array());
        out.write(header.fileNameBytes());
        out.write(header.extraFieldBytes());
        out.write(header.fileCommentBytes());
    }

    public static void encode(EndOfCentralDirectoryRecord record, OutputStream out) throws IOException {
        checkLength("archive comment", record.commentBytes());

        ByteBuffer buffer = newBuffer(EndOfCentralDirectoryRecord.FIXED_SIZE);
        writeU32(buffer, EndOfCentralDirectoryRecord.SIGNATURE);
        writeU16(buffer, record.getDiskNumber());
        writeU16(buffer, record.getCentralDirectoryDisk());
        writeU16(buffer, record.getEntriesOnDisk());
        writeU16(buffer, record.getTotalEntries());
        writeU32(buffer, record.getCentralDirectorySize());
        writeU32(buffer, record.getCentralDirectoryOffset());
        writeU16(buffer, record.getCommentLength());

        out.write(buffer.array());
        out.write(record.commentBytes());
    }

    /**
     * Reads a 32-bit little-endian value from {@code bytes} at {@code index}.
     */
    public static long readU32(byte[] bytes, int index) {
        return (bytes[index] & 0xFFL)
            | ((bytes[index + 1] & 0xFFL) << 8)
            | ((bytes[index + 2] & 0xFFL) << 16)
            | ((bytes[index + 3] & 0xFFL) << 24);
    }

    /**
     * Reads the signature, checks it, then reads the rest of the fixed portion. The signature is
     * read on its own so that a foreign record near the end of the source is reported as a bad
     * signature rather than as a short read.
     */
    private static ByteBuffer readRecord(SeekableSource in, long expectedSignature, int fixedSize, long offset)
            throws IOException {
        byte[] signature = new byte[SIGNATURE_SIZE];
        in.readFully(signature);
        long actual = readU32(signature, 0);
        if (actual != expectedSignature) {
            throw new InvalidSignatureException(actual, expectedSignature, offset);
        }

        byte[] fixed = new byte[fixedSize - SIGNATURE_SIZE];
        in.readFully(fixed);
        return ByteBuffer.wrap(fixed).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static byte[] readBytes(SeekableSource in, int length) throws IOException {
        byte[] bytes = new byte[length];
        in.readFully(bytes);
        return bytes;
    }

    private static String readText(SeekableSource in, int length, String field) throws IOException {
        long offset = in.position();
        byte[] bytes = readBytes(in, length);
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            NonUtf8FieldException failure = new NonUtf8FieldException(field, offset);
            failure.initCause(e);
            throw failure;
        }
    }

    private static int readU16(ByteBuffer buffer) {
        return buffer.getShort() & 0xFFFF;
    }

    private static long readU32(ByteBuffer buffer) {
        return buffer.getInt() & 0xFFFFFFFFL;
    }

    private static DosDateTime readDateTime(ByteBuffer buffer) {
        int time = readU16(buffer);
        int date = readU16(buffer);
        return DosDateTime.fromWords(time, date);
    }

    private static ByteBuffer newBuffer(int size) {
        return ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    private static void writeU16(ByteBuffer buffer, int value) {
        buffer.putShort((short) value);
    }

    private static void writeU32(ByteBuffer buffer, long value) {
        buffer.putInt((int) value);
    }

    private static void writeDateTime(ByteBuffer buffer, DosDateTime dateTime) {
        writeU16(buffer, dateTime.getTimeWord());
        writeU16(buffer, dateTime.getDateWord());
    }

    private static void checkLength(String field, byte[] bytes) throws FieldTooLongException {
        if (bytes.length > FieldChecks.MAX_U16) {
            throw new FieldTooLongException(field, bytes.length);
        }
    }
}
