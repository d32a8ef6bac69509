package net.schedra.core.validation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 느슨한 원본 값(YAML, 프로퍼티 바인딩 결과) 변환 도우미.
 * 프로퍼티 바인딩은 리스트를 {"0": .., "1": ..} 또는 {"[0]": ..} 형태 맵으로 주기도 하므로 리스트로 되돌린다.
 */
public final class RawValues {
    private static final Pattern INDEX = Pattern.compile("\\[?(\\d+)]?");

    private RawValues() {}

    public static int asInt(Object v) {
        if (v instanceof Integer i) return i;
        if (v instanceof Number n) {
            double d = n.doubleValue();
            if (d != Math.rint(d) || Math.abs(d) > Integer.MAX_VALUE) throw new IllegalArgumentException("not an integer: " + v);
            return (int) d;
        }
        if (v instanceof String s) return Integer.parseInt(s.trim());
        throw new IllegalArgumentException("not an integer: " + v);
    }

    public static boolean asBool(Object v, boolean dflt) {
        if (v == null) return dflt;
        if (v instanceof Boolean b) return b;
        if (v instanceof String s) {
            String t = s.trim().toLowerCase(Locale.ROOT);
            if (t.equals("true") || t.equals("yes") || t.equals("on")) return true;
            if (t.equals("false") || t.equals("no") || t.equals("off")) return false;
        }
        if (v instanceof Number n) return n.intValue() != 0;
        throw new IllegalArgumentException("not a boolean: " + v);
    }

    /** 항상 변경 가능한 새 리스트. null → 빈 리스트, 스칼라 → 한 원소 리스트 */
    public static List<Object> asList(Object v) {
        if (v == null) return new ArrayList<>();
        if (v instanceof List<?> l) return new ArrayList<>(l);
        if (v instanceof Map<?, ?> m && isIndexed(m)) {
            TreeMap<Integer, Object> sorted = new TreeMap<>();
            m.forEach((k, val) -> sorted.put(index(k), val));
            return new ArrayList<>(sorted.values());
        }
        List<Object> single = new ArrayList<>(1);
        single.add(v);
        return single;
    }

    public static boolean isList(Object v) {
        return v instanceof List || (v instanceof Map<?, ?> m && isIndexed(m));
    }

    /** 매핑이 아니면 null */
    public static Map<String, Object> asMap(Object v) {
        if (!(v instanceof Map<?, ?> m) || isIndexed(m)) return null;
        Map<String, Object> out = new LinkedHashMap<>();
        m.forEach((k, val) -> out.put(String.valueOf(k), val));
        return out;
    }

    private static int index(Object key) {
        Matcher m = INDEX.matcher(key.toString());
        if (!m.matches()) throw new IllegalArgumentException("not an index: " + key);
        return Integer.parseInt(m.group(1));
    }

    private static boolean isIndexed(Map<?, ?> m) {
        if (m.isEmpty()) return false;
        for (Object k : m.keySet()) {
            if (k == null || !INDEX.matcher(k.toString()).matches()) return false;
        }
        return true;
    }
}
