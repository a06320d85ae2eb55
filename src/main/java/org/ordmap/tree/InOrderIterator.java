package org.ordmap.tree;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;

import com.google.common.collect.AbstractIterator;

/**
 * Lazily walks a tree in key order, keeping the chain of nodes whose left subtrees are being visited on an explicit stack. Each step costs
 * amortized constant time and the stack never holds more than the tree's height.
 *
 * @param <K> The key type of the tree
 * @param <V> The value type of the tree
 * @param <T> The type produced for each node
 */
class InOrderIterator<K, V, T> extends AbstractIterator<T> {
	private final Deque<AvlNode<K, V>> thePath;
	private final Function<? super AvlNode<K, V>, ? extends T> theProducer;

	/**
	 * @param root The root of the tree to walk. May be null.
	 * @param producer Produces the iterator's value for each node
	 */
	InOrderIterator(AvlNode<K, V> root, Function<? super AvlNode<K, V>, ? extends T> producer) {
		thePath = new ArrayDeque<>();
		theProducer = producer;
		descendLeft(root);
	}

	private void descendLeft(AvlNode<K, V> node) {
		while (node != null) {
			thePath.push(node);
			node = node.getLeft();
		}
	}

	@Override
	protected T computeNext() {
		if (thePath.isEmpty())
			return endOfData();
		AvlNode<K, V> node = thePath.pop();
		descendLeft(node.getRight());
		return theProducer.apply(node);
	}
}
