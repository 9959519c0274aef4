package cn.iinti.proxyfinder.resource;

/**
 * 候选代理被丢弃的原因，只用于日志和探测结果，不会作为异常抛给调用方
 */
public enum DropReason {
    /**
     * 不是合法的 IPv4:port 格式
     */
    MALFORMED,
    /**
     * 同一轮抓取中已经出现过
     */
    DUPLICATE,
    /**
     * 国家不在调用方指定的范围内
     */
    COUNTRY_MISMATCH,
    /**
     * 超过单轮最大候选数量
     */
    OVERFLOW,
    /**
     * 连通性检查失败（tcp无法建立）
     */
    UNREACHABLE,
    /**
     * tcp可达，但没有任何一个回显接口可以通过代理访问
     */
    NOT_FUNCTIONAL,
    /**
     * 代理返回407，需要用户名密码
     */
    AUTH_REQUIRED,
    /**
     * 匿名等级不满足要求
     */
    ANONYMITY_MISMATCH,
    /**
     * 探测尚未完成，但整体截止时间已到
     */
    DEADLINE,
}
