package cn.iinti.proxyfinder.exception;

/**
 * 调用参数或配置错误（非法国家代码、匿名等级等），在发起任何网络请求之前抛出，不做重试
 */
public class ConfigurationException extends ProxyFinderException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
