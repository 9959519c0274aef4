package cn.iinti.proxyfinder;


import cn.iinti.proxyfinder.exception.ConfigurationException;
import cn.iinti.proxyfinder.exception.ExhaustionException;
import cn.iinti.proxyfinder.proxy.ProxyFinder;
import cn.iinti.proxyfinder.proxy.diagnostics.DiagnosticsReport;
import cn.iinti.proxyfinder.proxy.diagnostics.EndpointStatus;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import com.google.common.base.Splitter;
import org.apache.commons.lang3.math.NumberUtils;

import java.io.File;
import java.net.URL;
import java.util.Collections;
import java.util.List;

/**
 * 命令行入口：Bootstrap [n] [country1,country2...]，或者 Bootstrap diagnose 检查本机网络
 */
public class Bootstrap {
    private static final int DEFAULT_COUNT = 5;

    static {
        URL configURL = Bootstrap.class.getClassLoader().getResource(Settings.DEFAULT_CONFIG);
        if (configURL != null && configURL.getProtocol().equals("file")) {
            File classPathDir = new File(configURL.getFile()).getParentFile();
            String absolutePath = classPathDir.getAbsolutePath();
            if (absolutePath.endsWith("target/classes") || absolutePath.endsWith("conf")) {
                System.setProperty("LOG_DIR", new File(classPathDir.getParentFile(), "logs").getAbsolutePath());
            }
        }
    }

    public static void main(String[] args) {
        if (args.length > 0 && "diagnose".equalsIgnoreCase(args[0])) {
            diagnose(ProxyFinder.create(Settings.load()).diagnose());
            return;
        }
        int n = args.length > 0 ? NumberUtils.toInt(args[0], DEFAULT_COUNT) : DEFAULT_COUNT;
        List<String> countries = args.length > 1
                ? Splitter.on(',').trimResults().omitEmptyStrings().splitToList(args[1])
                : Collections.emptyList();

        Settings settings = Settings.load();
        if (settings.getIpSourceList().isEmpty()) {
            System.err.println("no ipSource defined");
            return;
        }

        ProxyFinder proxyFinder = ProxyFinder.create(settings);
        List<ValidatedProxy> proxies;
        try {
            proxies = proxyFinder.getMany(n, countries, null);
        } catch (ConfigurationException e) {
            System.err.println("bad argument: " + e.getMessage());
            return;
        } catch (ExhaustionException e) {
            System.err.println("no working proxy found after " + e.getRounds() + " rounds");
            return;
        }
        for (ValidatedProxy proxy : proxies) {
            System.out.println(proxy.getAddress() + "\t" + proxy.getCountry() + "\t" + proxy.getAnonymity()
                    + "\t" + proxy.getLatencySeconds() + "s\t" + proxy.getStatus()
                    + (proxy.isRequiresAuth() ? "\tauth" : ""));
        }
        System.out.println("found " + proxies.size() + " of " + n + " proxies");
    }

    private static void diagnose(DiagnosticsReport report) {
        for (EndpointStatus status : report.getConnectivity()) {
            printStatus("connectivity", status);
        }
        for (EndpointStatus status : report.getEchoEndpoints()) {
            printStatus("echo", status);
        }
        System.out.println(report.summary());
    }

    private static void printStatus(String kind, EndpointStatus status) {
        System.out.println(kind + "\t" + status.getUrl() + "\t" + (status.isWorking() ? "OK" : "FAIL")
                + (status.getResponseSeconds() != null ? "\t" + status.getResponseSeconds() + "s" : "")
                + (status.getError() != null ? "\t" + status.getError() : ""));
    }
}
