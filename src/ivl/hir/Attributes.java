package ivl.hir;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Ordered key/parameter metadata attached to declarations and commands,
 * printed as <b>{:key p1, p2}</b>. A parameter is either an {@link Expr} or
 * a {@link String}. Keys may repeat; every lookup returns the first match.
 */
public class Attributes implements Cloneable {

    /** One <b>{:key ...}</b> entry. */
    public static final class Entry {

        private final String key;
        private final List<Object> params;

        public Entry(String key, List<Object> params) {
            this.key = key;
            this.params = new ArrayList<Object>(params);
        }

        public String getKey() {
            return key;
        }

        public List<Object> getParams() {
            return Collections.unmodifiableList(params);
        }

        private Entry copy() {
            List<Object> copied = new ArrayList<Object>(params.size());
            for (Object p : params) {
                copied.add((p instanceof Expr) ? ((Expr)p).clone() : p);
            }
            return new Entry(key, copied);
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{:").append(key);
            for (int i = 0; i < params.size(); i++) {
                sb.append((i == 0) ? " " : ", ");
                Object p = params.get(i);
                if (p instanceof String) {
                    sb.append(quote((String)p));
                } else {
                    sb.append(p);
                }
            }
            return sb.append("}").toString();
        }
    }

    private final List<Entry> entries;

    public Attributes() {
        entries = new ArrayList<Entry>();
    }

    public Attributes(List<Entry> entries) {
        this.entries = new ArrayList<Entry>(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /** Appends a new entry and returns this object for chaining. */
    public Attributes add(String key, Object... params) {
        entries.add(new Entry(key, Arrays.asList(params)));
        return this;
    }

    /** Inserts a new entry in front of the existing ones. */
    public Attributes prepend(String key, Object... params) {
        entries.add(0, new Entry(key, Arrays.asList(params)));
        return this;
    }

    /**
    * Replaces the parameters of the first entry with the given key, or
    * appends a new entry if the key is absent.
    */
    public Attributes put(String key, Object... params) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).getKey().equals(key)) {
                entries.set(i, new Entry(key, Arrays.asList(params)));
                return this;
            }
        }
        return add(key, params);
    }

    /** Removes every entry with the given key. */
    public Attributes remove(String key) {
        for (int i = entries.size() - 1; i >= 0; i--) {
            if (entries.get(i).getKey().equals(key)) {
                entries.remove(i);
            }
        }
        return this;
    }

    public boolean contains(String key) {
        return getParams(key) != null;
    }

    /** Returns the parameters of the first entry with the key, or null. */
    public List<Object> getParams(String key) {
        for (Entry e : entries) {
            if (e.getKey().equals(key)) {
                return e.getParams();
            }
        }
        return null;
    }

    /**
    * Returns true if the key is present without parameters, or with the
    * single parameter <b>true</b>.
    */
    public boolean findBool(String key) {
        List<Object> params = getParams(key);
        if (params == null) {
            return false;
        }
        if (params.isEmpty()) {
            return true;
        }
        Object p = params.get(0);
        return (p instanceof LiteralExpr) && ((LiteralExpr)p).isTrue();
    }

    /** Returns the integer parameter of the key, or dflt if absent. */
    public int findInt(String key, int dflt) {
        List<Object> params = getParams(key);
        if (params == null || params.size() != 1) {
            return dflt;
        }
        Object p = params.get(0);
        if (p instanceof LiteralExpr) {
            BigInteger value = ((LiteralExpr)p).getValue();
            if (value != null) {
                return value.intValue();
            }
        }
        return dflt;
    }

    /** Returns the string parameter of the key, or null if absent. */
    public String findString(String key) {
        List<Object> params = getParams(key);
        if (params == null || params.size() != 1 || !(params.get(0) instanceof String)) {
            return null;
        }
        return (String)params.get(0);
    }

    /** Returns the expression parameter of the key, or null if absent. */
    public Expr findExpr(String key) {
        List<Object> params = getParams(key);
        if (params == null || params.size() != 1 || !(params.get(0) instanceof Expr)) {
            return null;
        }
        return (Expr)params.get(0);
    }

    /** Deep copy; expression parameters are cloned. */
    @Override
    public Attributes clone() {
        List<Entry> copied = new ArrayList<Entry>(entries.size());
        for (Entry e : entries) {
            copied.add(e.copy());
        }
        return new Attributes(copied);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Entry e : entries) {
            sb.append(e).append(" ");
        }
        return sb.toString();
    }

    static String quote(String s) {
        return "\"" + s.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
