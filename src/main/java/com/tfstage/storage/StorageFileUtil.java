package com.tfstage.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装定宽字符串列编解码与 CRC32 校验逻辑。
 */
final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 将字符串以 UTF-8 写入定宽槽位，不足部分补 NUL。
     *
     * @param buffer 目标缓冲区
     * @param value 字符串值
     * @param width 槽位字节宽度
     * @throws IllegalArgumentException 值为空、超宽或包含 NUL 时抛出
     */
    static void putFixedWidth(ByteBuffer buffer, String value, int width) {
        if (value == null) {
            throw new IllegalArgumentException("定宽列值不能为空");
        }
        if (value.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("定宽列值不能包含 NUL: " + value);
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length > width) {
            throw new IllegalArgumentException("定宽列值超过 " + width + " 字节: " + value);
        }
        buffer.put(bytes);
        for (int padding = bytes.length; padding < width; padding++) {
            buffer.put((byte) 0);
        }
    }

    /**
     * 从定宽槽位解码字符串，去掉尾部 NUL 填充。
     *
     * @param bytes 列数据
     * @param offset 槽位起始偏移
     * @param width 槽位字节宽度
     * @return 解码后的字符串
     */
    static String getFixedWidth(byte[] bytes, int offset, int width) {
        int length = width;
        while (length > 0 && bytes[offset + length - 1] == 0) {
            length--;
        }
        return new String(bytes, offset, length, StandardCharsets.UTF_8);
    }

    /**
     * 计算字节区间的 CRC32。
     *
     * @param bytes 数据
     * @param offset 起始偏移
     * @param length 参与校验的长度
     * @return CRC32 无符号值
     */
    static long crc32(byte[] bytes, int offset, int length) {
        CRC32 crc32 = new CRC32();
        crc32.update(bytes, offset, length);
        return crc32.getValue();
    }

    /**
     * 从指定位置完整读取字节数组。
     *
     * @param randomAccessFile 源文件
     * @param position 起始位置
     * @param target 目标数组
     * @throws IOException 遇到 EOF 或读取失败时抛出
     */
    static void readFully(RandomAccessFile randomAccessFile, long position, byte[] target) throws IOException {
        if (position + target.length > randomAccessFile.length()) {
            throw new EOFException("读取越过文件末尾: position=" + position + ", length=" + target.length);
        }
        randomAccessFile.seek(position);
        randomAccessFile.readFully(target);
    }
}
