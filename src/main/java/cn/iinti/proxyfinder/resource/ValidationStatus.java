package cn.iinti.proxyfinder.resource;

public enum ValidationStatus {
    /**
     * 至少有一个回显接口通过代理请求成功
     */
    VALID,
    /**
     * 端口可以连通，但功能探测全部失败（或需要鉴权），宽松模式下保留
     */
    UNVALIDATED
}
