package cn.iinti.proxyfinder.resource;

import cn.iinti.proxyfinder.utils.IpUtils;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nullable;

@Getter
public class IpAndPort {
    private final String ip;
    private final Integer port;
    private final String ipPort;


    public IpAndPort(String ip, Integer port) {
        this.ip = ip;
        this.port = port;
        this.ipPort = ip + ":" + port;
    }

    /**
     * 严格解析 IPv4:port，端口范围 [1,65535]
     *
     * @return null if the address is malformed
     */
    @Nullable
    public static IpAndPort parse(@Nullable String address) {
        if (address == null) {
            return null;
        }
        int index = address.indexOf(':');
        if (index <= 0 || index != address.lastIndexOf(':')) {
            return null;
        }
        String ip = address.substring(0, index);
        String portStr = address.substring(index + 1);
        if (!IpUtils.isIpV4(ip)) {
            return null;
        }
        if (!StringUtils.isNumeric(portStr) || portStr.length() > 5) {
            return null;
        }
        int port = Integer.parseInt(portStr);
        if (port < 1 || port > 65535) {
            return null;
        }
        return new IpAndPort(ip, port);
    }

    @Override
    public String toString() {
        return ipPort;
    }
}
