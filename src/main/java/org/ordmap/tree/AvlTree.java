package org.ordmap.tree;

import java.util.Comparator;

import org.apache.log4j.Logger;

/**
 * A height-balanced (AVL) binary search tree structure.
 *
 * Each node keeps a balance factor (right height minus left height) in {-1, 0, 1}. Insertion walks up from the new node adjusting balance
 * factors and performs at most one single or double rotation. Deletion walks up from the spliced position and may rotate at several
 * ancestors, since a rotation can itself shrink the height of the rotated subtree.
 *
 * The tree does not hold its ordering. Every search and modification is given the comparator by the caller, who must pass the same one
 * each time.
 *
 * @param <K> The type of keys stored in the tree
 * @param <V> The type of values stored in the tree
 */
public class AvlTree<K, V> {
	private static final Logger log = Logger.getLogger(AvlTree.class);

	private AvlNode<K, V> theRoot;

	/** @return The root node of this tree, or null if the tree is empty */
	public AvlNode<K, V> getRoot() {
		return theRoot;
	}

	/**
	 * @param first Whether to return the left-most or right-most node
	 * @return The left-most (if <code>first</code>) or right-most (otherwise) node in this tree, or null if the tree is empty
	 */
	public AvlNode<K, V> getTerminal(boolean first) {
		return theRoot == null ? null : theRoot.getTerminal(first);
	}

	/** Drops every node in the tree */
	public void clear() {
		theRoot = null;
	}

	/**
	 * @param key The key to search for
	 * @param compare The key ordering
	 * @return The node whose key compares equal to the given key, or null if there is no such node
	 */
	public AvlNode<K, V> find(K key, Comparator<? super K> compare) {
		AvlNode<K, V> node = theRoot;
		while (node != null) {
			int comp = compare.compare(key, node.getKey());
			if (comp == 0)
				return node;
			node = node.getChild(comp < 0);
		}
		return null;
	}

	/**
	 * Inserts an entry, or replaces the value of the entry already stored under an equal key
	 *
	 * @param key The key to insert
	 * @param value The value to associate with the key
	 * @param compare The key ordering
	 * @return True if a new node was added, false if an existing node's value was replaced
	 */
	public boolean insert(K key, V value, Comparator<? super K> compare) {
		if (theRoot == null) {
			theRoot = new AvlNode<>(key, value);
			return true;
		}
		AvlNode<K, V> parent = theRoot;
		boolean left;
		while (true) {
			int comp = compare.compare(key, parent.getKey());
			if (comp == 0) {
				parent.setValue(value);
				return false;
			}
			left = comp < 0;
			AvlNode<K, V> child = parent.getChild(left);
			if (child == null)
				break;
			parent = child;
		}
		AvlNode<K, V> node = new AvlNode<>(key, value);
		parent.setChild(node, left);
		fixAfterInsertion(node);
		return true;
	}

	/**
	 * Removes the entry stored under a key equal to the given key, if there is one
	 *
	 * @param key The key to remove
	 * @param compare The key ordering
	 * @return Whether an entry was removed
	 */
	public boolean delete(K key, Comparator<? super K> compare) {
		AvlNode<K, V> node = find(key, compare);
		if (node == null)
			return false;
		if (node.getLeft() != null && node.getRight() != null) {
			// Take the successor's entry and remove the successor instead, which has no left child
			AvlNode<K, V> successor = node.getRight().getTerminal(true);
			node.replaceEntry(successor.getKey(), successor.getValue());
			node = successor;
		}
		AvlNode<K, V> replacement = node.getLeft() != null ? node.getLeft() : node.getRight();
		AvlNode<K, V> parent = node.getParent();
		boolean side = node.getSide();
		if (parent == null) {
			theRoot = replacement;
			if (replacement != null)
				replacement.setParent(null);
		} else
			parent.setChild(replacement, side);
		node.detach();
		if (parent != null)
			fixAfterDeletion(parent, side);
		return true;
	}

	/** @return An independent copy of this tree with the same shape and balance */
	public AvlTree<K, V> copy() {
		AvlTree<K, V> copy = new AvlTree<>();
		if (theRoot != null)
			copy.theRoot = deepCopy(theRoot);
		return copy;
	}

	private static <K, V> AvlNode<K, V> deepCopy(AvlNode<K, V> node) {
		AvlNode<K, V> copy = new AvlNode<>(node.getKey(), node.getValue());
		copy.setBalance(node.getBalance());
		if (node.getLeft() != null)
			copy.setChild(deepCopy(node.getLeft()), true);
		if (node.getRight() != null)
			copy.setChild(deepCopy(node.getRight()), false);
		return copy;
	}

	/**
	 * Walks up from a newly attached leaf. An ancestor that goes from leaning to balanced absorbs the growth and stops the walk. One that
	 * goes from balanced to leaning has grown, so the walk continues. One that would lean by 2 is rotated, after which its subtree has its
	 * old height again.
	 */
	private void fixAfterInsertion(AvlNode<K, V> node) {
		AvlNode<K, V> child = node;
		AvlNode<K, V> parent = child.getParent();
		while (parent != null) {
			boolean left = child.getSide();
			int lean = left ? -1 : 1;
			int balance = parent.getBalance() + lean;
			if (balance == 0) {
				parent.setBalance(0);
				return;
			} else if (balance == lean) {
				parent.setBalance(balance);
				child = parent;
				parent = child.getParent();
			} else {
				rebalance(parent, left);
				return;
			}
		}
	}

	/**
	 * Walks up from the parent of a spliced node, whose subtree on the given side has just shrunk by one. An ancestor that goes from
	 * balanced to leaning keeps its height and stops the walk. One that goes from leaning to balanced has shrunk, so the walk continues. One
	 * that would lean by 2 is rotated, and the walk continues only if the rotation shrank the subtree.
	 */
	private void fixAfterDeletion(AvlNode<K, V> parent, boolean shrunkLeft) {
		while (parent != null) {
			int lean = shrunkLeft ? 1 : -1;
			int balance = parent.getBalance() + lean;
			AvlNode<K, V> top;
			if (balance == lean) {
				parent.setBalance(balance);
				return;
			} else if (balance == 0) {
				parent.setBalance(0);
				top = parent;
			} else {
				top = rebalance(parent, !shrunkLeft);
				if (top.getBalance() != 0)
					return;
			}
			shrunkLeft = top.getSide();
			parent = top.getParent();
		}
	}

	/**
	 * Restores balance at a node whose subtree on one side has become 2 taller than the other. A single rotation is used if the taller child
	 * leans the same way (or not at all), a double rotation if it leans inward.
	 *
	 * @param node The unbalanced node
	 * @param heavyLeft Whether the left side is the taller one
	 * @return The node now at the top of the rebalanced subtree
	 */
	private AvlNode<K, V> rebalance(AvlNode<K, V> node, boolean heavyLeft) {
		int lean = heavyLeft ? -1 : 1;
		AvlNode<K, V> child = node.getChild(heavyLeft);
		if (child == null)
			throw new IllegalStateException("Node " + node + " is heavy on the " + (heavyLeft ? "left" : "right") + " but has no child there");
		node.setBalance(lean * 2);
		if (child.getBalance() == -lean)
			rotate(child, heavyLeft);
		return rotate(node, !heavyLeft);
	}

	/**
	 * Performs a rotation, updating the balance factors of the two nodes that move. The formulas hold for any starting balance, so they
	 * cover the insertion cases, the deletion case where the pivot is balanced, and each half of a double rotation.
	 *
	 * @param node The node to rotate down
	 * @param left Whether to rotate left (the right child rises) or right (the left child rises)
	 * @return The pivot, which has taken the node's place
	 */
	private AvlNode<K, V> rotate(AvlNode<K, V> node, boolean left) {
		AvlNode<K, V> pivot = node.getChild(!left);
		if (log.isDebugEnabled())
			log.debug("Rotate " + (left ? "left" : "right") + " at " + node + ", pivot " + pivot);
		AvlNode<K, V> inner = pivot.getChild(left);
		AvlNode<K, V> oldParent = node.getParent();
		boolean oldSide = node.getSide();

		node.setChild(inner, !left);
		pivot.setChild(node, left);
		if (oldParent != null)
			oldParent.setChild(pivot, oldSide);
		else {
			pivot.setParent(null);
			theRoot = pivot;
		}

		int nodeBalance = node.getBalance();
		int pivotBalance = pivot.getBalance();
		if (left) {
			nodeBalance = nodeBalance - 1 - Math.max(pivotBalance, 0);
			pivotBalance = pivotBalance - 1 + Math.min(nodeBalance, 0);
		} else {
			nodeBalance = nodeBalance + 1 - Math.min(pivotBalance, 0);
			pivotBalance = pivotBalance + 1 + Math.max(nodeBalance, 0);
		}
		node.setBalance(nodeBalance);
		pivot.setBalance(pivotBalance);
		return pivot;
	}

	/**
	 * Prints a tree in a way that indicates the position of each node in the tree
	 *
	 * @param tree The tree node to print
	 * @return The printed representation of the node
	 */
	public static String print(AvlNode<?, ?> tree) {
		StringBuilder ret = new StringBuilder();
		print(tree, ret, 0);
		return ret.toString();
	}

	/**
	 * Prints a tree sideways, right subtree first, one node per line
	 *
	 * @param tree The tree node to print
	 * @param str The string builder to append the printed tree representation to
	 * @param indent The amount of indentation with which to indent the root of the tree
	 */
	public static void print(AvlNode<?, ?> tree, StringBuilder str, int indent) {
		if (tree == null) {
			for (int i = 0; i < indent; i++)
				str.append('\t');
			str.append(tree).append('\n');
			return;
		}

		AvlNode<?, ?> right = tree.getRight();
		if (right != null)
			print(right, str, indent + 1);

		for (int i = 0; i < indent; i++)
			str.append('\t');
		str.append(tree).append('\n');

		AvlNode<?, ?> left = tree.getLeft();
		if (left != null)
			print(left, str, indent + 1);
	}

	@Override
	public String toString() {
		return print(theRoot);
	}
}
