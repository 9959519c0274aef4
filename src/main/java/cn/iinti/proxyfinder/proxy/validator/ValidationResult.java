package cn.iinti.proxyfinder.proxy.validator;

import cn.iinti.proxyfinder.resource.DropReason;
import cn.iinti.proxyfinder.resource.ValidatedProxy;
import lombok.Getter;

import javax.annotation.Nullable;

/**
 * 单个候选的探测结果：要么是一个ValidatedProxy，要么是丢弃原因
 */
@Getter
public class ValidationResult {
    private final String address;
    @Nullable
    private final ValidatedProxy proxy;
    @Nullable
    private final DropReason dropReason;

    private ValidationResult(String address, @Nullable ValidatedProxy proxy, @Nullable DropReason dropReason) {
        this.address = address;
        this.proxy = proxy;
        this.dropReason = dropReason;
    }

    public static ValidationResult valid(ValidatedProxy proxy) {
        return new ValidationResult(proxy.getAddress(), proxy, null);
    }

    public static ValidationResult invalid(String address, DropReason dropReason) {
        return new ValidationResult(address, null, dropReason);
    }

    public boolean isSuccess() {
        return proxy != null;
    }

    @Override
    public String toString() {
        return isSuccess() ? "valid:" + proxy : "invalid:" + address + "(" + dropReason + ")";
    }
}
