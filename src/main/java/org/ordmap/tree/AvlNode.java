package org.ordmap.tree;

/**
 * A node in an AVL binary tree structure.
 *
 * This class only holds structure. All searching and rebalancing is done by {@link AvlTree}, which is the only code permitted to modify a
 * node's links or balance.
 *
 * @param <K> The type of key that the node holds
 * @param <V> The type of value that the node holds
 */
public final class AvlNode<K, V> {
	private K theKey;
	private V theValue;

	private AvlNode<K, V> theParent;
	private AvlNode<K, V> theLeft;
	private AvlNode<K, V> theRight;
	/** Height of the right subtree minus height of the left. In {-1, 0, 1} except in the middle of a rebalance. */
	private int theBalance;

	/**
	 * @param key The key for this node
	 * @param value The value for this node
	 */
	AvlNode(K key, V value) {
		theKey = key;
		theValue = value;
	}

	/** @return This node's key */
	public K getKey() {
		return theKey;
	}

	/** @return This node's value */
	public V getValue() {
		return theValue;
	}

	/** @param value The new value for this node */
	void setValue(V value) {
		theValue = value;
	}

	/**
	 * Moves another node's entry into this node. Used when deleting a node with two children, whose place in the tree is then taken by its
	 * successor's entry.
	 *
	 * @param key The key to take
	 * @param value The value to take
	 */
	void replaceEntry(K key, V value) {
		theKey = key;
		theValue = value;
	}

	/** @return The height of this node's right subtree minus the height of its left subtree */
	public int getBalance() {
		return theBalance;
	}

	void setBalance(int balance) {
		theBalance = balance;
	}

	/** @return The parent of this node in the tree structure. Will be null if and only if this node is the root (or an orphan). */
	public AvlNode<K, V> getParent() {
		return theParent;
	}

	void setParent(AvlNode<K, V> parent) {
		if (parent == this)
			throw new IllegalArgumentException("A tree node cannot be its own parent: " + parent);
		theParent = parent;
	}

	/** @return The child node that is on the left of this node */
	public AvlNode<K, V> getLeft() {
		return theLeft;
	}

	/** @return The child node that is on the right of this node */
	public AvlNode<K, V> getRight() {
		return theRight;
	}

	/**
	 * @param left Whether to get the left or right child
	 * @return The left or right child of this node
	 */
	public AvlNode<K, V> getChild(boolean left) {
		return left ? theLeft : theRight;
	}

	/**
	 * Sets one of this node's children, pointing the child's parent link back at this node. The replaced child's parent link is not touched.
	 *
	 * @param child The new child for this node
	 * @param left Whether to set the left or the right child
	 * @return The child (or null) that was replaced as this node's left or right child
	 */
	AvlNode<K, V> setChild(AvlNode<K, V> child, boolean left) {
		if (child == this)
			throw new IllegalArgumentException(
				"A tree node cannot have itself as a child: " + this + " (" + (left ? "left" : "right") + ")");
		AvlNode<K, V> oldChild;
		if (left) {
			oldChild = theLeft;
			theLeft = child;
		} else {
			oldChild = theRight;
			theRight = child;
		}
		if (child != null)
			child.setParent(this);
		return oldChild;
	}

	/** @return Whether this node is on the right (false) or the left (true) of its parent. False for the root. */
	public boolean getSide() {
		if (theParent == null)
			return false;
		return this == theParent.theLeft;
	}

	/**
	 * @param left Whether to get the first node or the last node
	 * @return The first or last node in this sub-tree
	 */
	public AvlNode<K, V> getTerminal(boolean left) {
		AvlNode<K, V> parent = this;
		AvlNode<K, V> child = parent.getChild(left);
		while (child != null) {
			parent = child;
			child = parent.getChild(left);
		}
		return parent;
	}

	/** Unlinks this node from its parent and children after it has been spliced out of the tree */
	void detach() {
		theParent = null;
		theLeft = null;
		theRight = null;
		theBalance = 0;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append(theKey).append('=').append(theValue);
		return str.append(" (").append(theBalance > 0 ? "+" : "").append(theBalance).append(')').toString();
	}
}
