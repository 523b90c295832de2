package ivl.hir;

import java.util.*;

/**
* Iterates over Traversable objects in depth-first order.
*
* <p>
* The iteration starts from the root object that was specified in the
* constructor. All objects are visited before their children (pre-order).
* </p>
*/
public class DepthFirstIterator<E extends Traversable> implements Iterator<E> {

    private final Traversable root;

    private final LinkedList<Traversable> stack;

    // Kept as a list rather than a set; it rarely holds more than one type.
    private final List<Class<? extends Traversable>> prune_list;

    public DepthFirstIterator(Traversable init) {
        root = init;
        stack = new LinkedList<Traversable>();
        stack.add(init);
        prune_list = new ArrayList<Class<? extends Traversable>>(4);
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        Traversable t = stack.removeFirst();
        List<? extends Traversable> children = t.getChildren();
        if (children != null && !needsPruning(t.getClass())) {
            for (int j = children.size() - 1; j >= 0; j--) {
                Traversable child = children.get(j);
                if (child != null) {
                    stack.addFirst(child);
                }
            }
        }
        return (E)t;
    }

    private boolean needsPruning(Class<? extends Traversable> c) {
        for (int i = 0; i < prune_list.size(); i++) {
            if (prune_list.get(i).isAssignableFrom(c)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Disables traversal from an object having the specified type. For example,
    * if traversal reaches an object with type <b>c</b>, it does not visit the
    * children of the object.
    *
    * @param c the object type to be pruned on.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        prune_list.add(c);
    }

    /**
    * Returns a list of objects of Class c in the IR
    *
    * @param c the object type to be collected.
    * @return the collected list.
    */
    @SuppressWarnings("unchecked")
    public <T extends Traversable> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Object o = next();
            if (c.isInstance(o)) {
                ret.add((T) o);
            }
        }
        return ret;
    }

    /**
    * Returns a set of objects of Class c in the IR
    *
    * @param c the object type to be collected.
    * @return the collected set.
    */
    @SuppressWarnings("unchecked")
    public <T extends Traversable> Set<T> getSet(Class<T> c) {
        Set<T> set = new LinkedHashSet<T>();
        while (hasNext()) {
            Object obj = next();
            if (c.isInstance(obj)) {
                set.add((T)obj);
            }
        }
        return set;
    }

    /**
    * Resets the iterator by setting the current position to the root object.
    * The pruned types are not cleared.
    */
    public void reset() {
        stack.clear();
        stack.add(root);
    }
}
