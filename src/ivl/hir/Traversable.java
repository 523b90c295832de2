package ivl.hir;

import java.util.List;

/**
 * Any IR object whose children can be visited by a
 * {@link DepthFirstIterator}.
 */
public interface Traversable {

    /**
    * Returns the child objects of this IR object in source order, or null if
    * the object is a leaf.
    */
    List<? extends Traversable> getChildren();
}
