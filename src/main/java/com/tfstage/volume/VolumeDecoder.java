package com.tfstage.volume;

import java.nio.file.Path;

/**
 * 卷解码协作者：给定路径，返回解码后的卷。
 */
@FunctionalInterface
public interface VolumeDecoder {

    /**
     * 解码一个卷文件。
     *
     * @param path 卷文件路径
     * @return 解码后的卷
     * @throws VolumeDecodeException 文件缺失、格式损坏或结构不符时抛出
     */
    DecodedVolume decode(Path path) throws VolumeDecodeException;
}
