package com.tfstage.config;

/**
 * 全局常量定义
 * 
 * 包含存储格式魔数、列宽、分批参数、检查点与恢复扫描参数
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }
    
    // ==================== 存储格式魔数 ====================
    /** 存储文件魔数 "TFST" */
    public static final int STORE_MAGIC = 0x54465354;
    /** 追加帧魔数 "TFFR" */
    public static final int FRAME_MAGIC = 0x54464652;
    /** 批提交记录魔数 "TFCM"，标记一批的全部帧已落盘 */
    public static final int COMMIT_MAGIC = 0x5446434D;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 存储文件扩展名 */
    public static final String STORE_FILE_SUFFIX = ".tfs";
    
    // ==================== 列宽参数 ====================
    /** 卷 ID 列宽（UTF-8 字节） */
    public static final int VOLUME_ID_WIDTH = 25;
    /** 词项列宽（UTF-8 字节），超长词项按字符截断 */
    public static final int TOKEN_WIDTH = 50;
    /** 语言列宽（UTF-8 字节） */
    public static final int LANGUAGE_WIDTH = 8;
    
    // ==================== 抽取参数 ====================
    /** 无法确定语言时的占位代码 */
    public static final String UNKNOWN_LANGUAGE = "und";
    /** 默认需要稀疏裁剪的主导语言 */
    public static final String DEFAULT_TRIM_LANGUAGE = "eng";
    /** 主导语言的批内最小计数，低于该值的词项被丢弃 */
    public static final int DEFAULT_TRIM_MIN_COUNT = 2;
    
    // ==================== 分批与调度参数 ====================
    /** 默认批大小 */
    public static final int DEFAULT_BATCH_SIZE = 25;
    /** 默认工作线程数 */
    public static final int DEFAULT_WORKERS = Runtime.getRuntime().availableProcessors();
    /** 工作线程数安全上限 */
    public static final int MAX_WORKERS = 256;
    /** 批队列容量 */
    public static final int BATCH_QUEUE_CAPACITY = 64;
    /** 每完成多少批输出一次进度日志 */
    public static final int PROGRESS_INTERVAL = 100;
    /** 等待批结果的单次超时（秒） */
    public static final long DEFAULT_RESULT_TIMEOUT_SECONDS = 300L;
    /** 连续超时多少次后判定工作线程卡死 */
    public static final int DEFAULT_MAX_STALLS = 12;
    
    // ==================== 检查点与恢复参数 ====================
    /** 默认检查点文件名 */
    public static final String CHECKPOINT_FILE_NAME = "successful-ids.txt";
    /** 运行汇总文件名 */
    public static final String RUN_SUMMARY_FILE_NAME = "run-summary.json";
    /** 恢复扫描的反向窗口行数 */
    public static final int DEFAULT_SCAN_WINDOW = 10_000;
    /** 卷 ID 命名空间校验正则：机构前缀 + '.' + 本地 ID */
    public static final String DEFAULT_ID_PATTERN = "^[a-z0-9]+\\.\\S+$";
    /** 卷文件默认后缀 */
    public static final String DEFAULT_VOLUME_SUFFIX = ".json.gz";
}
