package cn.iinti.proxyfinder.resource;

import lombok.Data;

/**
 * 代理源给出的一个候选代理，尚未经过任何验证，只在一轮抓取-过滤-探测过程中存在
 */
@Data
public class CandidateProxy {

    public static final String UNKNOWN_COUNTRY = "unknown";

    /**
     * ip:port
     */
    private String address;

    /**
     * 代理源声称的国家（ISO两位代码），没有时为unknown
     */
    private String countryHint = UNKNOWN_COUNTRY;

    private Anonymity anonymityHint = Anonymity.UNKNOWN;

    private String sourceName;

    private long fetchedAt;

    public CandidateProxy() {
    }

    public CandidateProxy(String address) {
        this.address = address;
    }

    public boolean isCountryKnown() {
        return countryHint != null && !UNKNOWN_COUNTRY.equalsIgnoreCase(countryHint);
    }

    @Override
    public String toString() {
        return address;
    }
}
