package com.tfstage.volume;

import java.nio.file.Path;

/**
 * 卷 ID 与相对路径之间的纯函数映射（pairtree 布局）。
 *
 * <p>{@code mdp.39015012345678} 映射为
 * {@code mdp/pairtree_root/39/01/50/12/34/56/78/39015012345678/mdp.39015012345678<suffix>}；
 * 本地 ID 中的 {@code : / .} 分别清洗为 {@code + = ,}。
 */
public final class VolumePaths {
    private final Path dataDir;
    private final String suffix;

    public VolumePaths(Path dataDir, String suffix) {
        if (dataDir == null) {
            throw new IllegalArgumentException("数据目录不能为空");
        }
        this.dataDir = dataDir;
        this.suffix = suffix == null ? "" : suffix;
    }

    /**
     * 将卷 ID 解析为数据目录下的绝对路径。
     */
    public Path resolve(String volumeId) {
        return dataDir.resolve(toRelativePath(volumeId, suffix));
    }

    /**
     * 计算卷 ID 的 pairtree 相对路径。
     */
    public static String toRelativePath(String volumeId, String suffix) {
        int dotIndex = requirePrefixSeparator(volumeId);
        String prefix = volumeId.substring(0, dotIndex);
        String cleaned = clean(volumeId.substring(dotIndex + 1));

        StringBuilder builder = new StringBuilder(prefix).append("/pairtree_root");
        for (int start = 0; start < cleaned.length(); start += 2) {
            builder.append('/').append(cleaned, start, Math.min(start + 2, cleaned.length()));
        }
        builder.append('/').append(cleaned)
            .append('/').append(prefix).append('.').append(cleaned)
            .append(suffix == null ? "" : suffix);
        return builder.toString();
    }

    /**
     * 从清单中的相对路径还原卷 ID（只看文件名）。
     */
    public static String idFromPath(String relativePath, String suffix) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("路径不能为空");
        }
        String normalized = relativePath.trim().replace('\\', '/');
        String fileName = normalized.substring(normalized.lastIndexOf('/') + 1);
        if (suffix != null && !suffix.isEmpty() && fileName.endsWith(suffix)) {
            fileName = fileName.substring(0, fileName.length() - suffix.length());
        }
        int dotIndex = requirePrefixSeparator(fileName);
        return fileName.substring(0, dotIndex + 1) + unclean(fileName.substring(dotIndex + 1));
    }

    static String clean(String localId) {
        return localId.replace(':', '+').replace('/', '=').replace('.', ',');
    }

    static String unclean(String cleanedId) {
        return cleanedId.replace('+', ':').replace('=', '/').replace(',', '.');
    }

    private static int requirePrefixSeparator(String value) {
        if (value == null) {
            throw new IllegalArgumentException("卷 ID 不能为空");
        }
        int dotIndex = value.indexOf('.');
        if (dotIndex <= 0 || dotIndex == value.length() - 1) {
            throw new IllegalArgumentException("卷 ID 缺少机构前缀: " + value);
        }
        return dotIndex;
    }
}
