package com.cloudgov.domain.hierarchy.service;

import com.cloudgov.domain.hierarchy.model.valobj.CidrInfo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * IPv4 CIDR 地址计算：解析、网络地址、主机数、包含与重叠判断、下一个可用网段。
 * <p>
 * 纯函数，无状态；任何格式或范围错误都返回无效结果，不抛异常。
 * </p>
 */
public final class CidrArithmeticService {

    private static final Pattern CIDR_PATTERN =
            Pattern.compile("^(\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3})/(\\d{1,2})$");

    private static final long ADDRESS_SPACE = 1L << 32;

    private static final CidrInfo[] PRIVATE_RANGES = {
            parseCidr("10.0.0.0/8"),
            parseCidr("172.16.0.0/12"),
            parseCidr("192.168.0.0/16")
    };

    private CidrArithmeticService() {
    }

    public static CidrInfo parseCidr(String input) {
        if (input == null || input.isEmpty()) {
            return CidrInfo.INVALID;
        }
        Matcher matcher = CIDR_PATTERN.matcher(input);
        if (!matcher.matches()) {
            return CidrInfo.INVALID;
        }
        int prefix = Integer.parseInt(matcher.group(2));
        if (prefix < 0 || prefix > 32) {
            return CidrInfo.INVALID;
        }
        String[] octets = matcher.group(1).split("\\.");
        long address = 0L;
        for (String octet : octets) {
            int value = Integer.parseInt(octet);
            if (value < 0 || value > 255) {
                return CidrInfo.INVALID;
            }
            address = (address << 8) | value;
        }
        long network = address & mask(prefix);
        long total = 1L << (32 - prefix);
        return new CidrInfo(true, render(network), prefix, total, usable(prefix, total));
    }

    public static boolean isValid(String input) {
        return parseCidr(input).valid();
    }

    /**
     * 广播地址（网段最后一个地址），无效输入返回空串。
     */
    public static String broadcastAddress(CidrInfo info) {
        if (info == null || !info.valid()) {
            return "";
        }
        return render(lastAddress(info));
    }

    /**
     * 是否完全落在 RFC 1918 私有地址段内。
     */
    public static boolean isPrivate(CidrInfo info) {
        if (info == null || !info.valid()) {
            return false;
        }
        for (CidrInfo range : PRIVATE_RANGES) {
            if (contains(range, info)) {
                return true;
            }
        }
        return false;
    }

    /**
     * child 是否为 parent 的子网（含相等）。
     */
    public static boolean contains(CidrInfo parent, CidrInfo child) {
        if (parent == null || child == null || !parent.valid() || !child.valid()) {
            return false;
        }
        if (child.prefix() < parent.prefix()) {
            return false;
        }
        return (toLong(child.network()) & mask(parent.prefix())) == toLong(parent.network());
    }

    /**
     * 两个网段是否至少共享一个地址。
     */
    public static boolean overlaps(CidrInfo left, CidrInfo right) {
        if (left == null || right == null || !left.valid() || !right.valid()) {
            return false;
        }
        return toLong(left.network()) <= lastAddress(right) && toLong(right.network()) <= lastAddress(left);
    }

    /**
     * 在父网段内寻找第一个与已有网段均不重叠的、按 prefix 对齐的网段。
     *
     * @return 网段表示；父网段无效、prefix 不合法或已耗尽时返回 null
     */
    public static String nextAvailableBlock(String parentCidr, List<String> existingCidrs, int prefix) {
        CidrInfo parent = parseCidr(parentCidr);
        if (!parent.valid() || prefix < parent.prefix() || prefix > 32) {
            return null;
        }
        List<CidrInfo> taken = new ArrayList<>();
        if (existingCidrs != null) {
            for (String cidr : existingCidrs) {
                CidrInfo info = parseCidr(cidr);
                if (info.valid()) {
                    taken.add(info);
                }
            }
        }
        long blockSize = 1L << (32 - prefix);
        long start = toLong(parent.network());
        long end = lastAddress(parent);
        long candidate = start;
        while (candidate + blockSize - 1 <= end) {
            CidrInfo block = new CidrInfo(true, render(candidate), prefix, blockSize, usable(prefix, blockSize));
            CidrInfo conflict = null;
            for (CidrInfo existing : taken) {
                if (overlaps(block, existing)) {
                    conflict = existing;
                    break;
                }
            }
            if (conflict == null) {
                return block.notation();
            }
            // 跳过冲突网段，按 blockSize 向上对齐
            long next = Math.max(candidate + blockSize, lastAddress(conflict) + 1);
            candidate = ((next + blockSize - 1) / blockSize) * blockSize;
        }
        return null;
    }

    /**
     * 子网段可用地址之和占父网段可用地址的百分比，封顶 100，保留两位小数。
     */
    public static double utilizationPercent(String parentCidr, List<String> childCidrs) {
        CidrInfo parent = parseCidr(parentCidr);
        if (!parent.valid() || parent.usableAddresses() <= 0) {
            return 0D;
        }
        long used = 0L;
        if (childCidrs != null) {
            for (String cidr : childCidrs) {
                CidrInfo child = parseCidr(cidr);
                if (child.valid()) {
                    used += child.usableAddresses();
                }
            }
        }
        double percent = Math.min(used * 100D / parent.usableAddresses(), 100D);
        return BigDecimal.valueOf(percent).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static long usable(int prefix, long total) {
        if (prefix <= 30) {
            return total - 2;
        }
        return prefix == 31 ? 2L : 1L;
    }

    private static long mask(int prefix) {
        if (prefix == 0) {
            return 0L;
        }
        return (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }

    private static long lastAddress(CidrInfo info) {
        return toLong(info.network()) + info.totalAddresses() - 1;
    }

    private static long toLong(String dottedQuad) {
        long value = 0L;
        for (String octet : dottedQuad.split("\\.")) {
            value = (value << 8) | Integer.parseInt(octet);
        }
        return value;
    }

    private static String render(long address) {
        long normalized = address % ADDRESS_SPACE;
        return ((normalized >> 24) & 0xFF) + "."
                + ((normalized >> 16) & 0xFF) + "."
                + ((normalized >> 8) & 0xFF) + "."
                + (normalized & 0xFF);
    }
}
