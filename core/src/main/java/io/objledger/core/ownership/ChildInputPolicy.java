// file: src/main/java/io/objledger/core/ownership/ChildInputPolicy.java
package io.objledger.core.ownership;

/** How object-owned inputs are authorized. */
public enum ChildInputPolicy {
    /** A child is usable when its parent chain reaches an authorized input of the same transaction. */
    THROUGH_PARENT,
    /** Children are never accepted as direct inputs. */
    REJECT
}
