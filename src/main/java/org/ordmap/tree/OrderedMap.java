package org.ordmap.tree;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;

import org.apache.log4j.Logger;
import org.ordmap.SimpleMapEntry;

/**
 * A key/value map whose iteration order is determined by a comparator rather than by hashing, backed by an {@link AvlTree}.
 *
 * The comparator must be pure and consistent with a total order. If it is not, lookups may miss keys that are present, but the tree's
 * structure stays intact.
 *
 * Iteration is lazy: each call to {@link #iterator()}, {@link #keys()}, {@link #values()} or {@link #entries()} starts a fresh in-order
 * walk. Modifying the map while a walk is being consumed gives unspecified (but non-failing) results. This class is not thread-safe.
 *
 * @param <K> The type of keys in the map
 * @param <V> The type of values in the map
 */
public class OrderedMap<K, V> implements Iterable<Map.Entry<K, V>> {
	private static final Logger log = Logger.getLogger(OrderedMap.class);

	/**
	 * Receives each entry of a map in order from {@link OrderedMap#forEach(EntryCallback)}
	 *
	 * @param <K> The key type of the map
	 * @param <V> The value type of the map
	 */
	@FunctionalInterface
	public interface EntryCallback<K, V> {
		/**
		 * @param value The value of the entry
		 * @param key The key of the entry
		 * @param map The map being iterated
		 */
		void accept(V value, K key, OrderedMap<? extends K, ? extends V> map);
	}

	private final Comparator<? super K> theCompare;
	private final AvlTree<K, V> theTree;
	private int theSize;

	/** @param compare The comparator to use to sort the keys */
	public OrderedMap(Comparator<? super K> compare) {
		this(compare, new AvlTree<>(), 0);
	}

	/**
	 * @param compare The comparator to use to sort the keys
	 * @param entries The initial entries for the map, {@link #set(Object, Object) set} in iteration order
	 */
	public OrderedMap(Comparator<? super K> compare, Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
		this(compare);
		for (Map.Entry<? extends K, ? extends V> entry : entries)
			set(entry.getKey(), entry.getValue());
		if (log.isDebugEnabled())
			log.debug("Loaded " + theSize + " initial entries");
	}

	/**
	 * @param compare The comparator to use to sort the keys
	 * @param entries The initial entries for the map
	 */
	public OrderedMap(Comparator<? super K> compare, Map<? extends K, ? extends V> entries) {
		this(compare, entries.entrySet());
	}

	private OrderedMap(Comparator<? super K> compare, AvlTree<K, V> tree, int size) {
		theCompare = compare;
		theTree = tree;
		theSize = size;
	}

	/** @return The comparator that orders this map's keys */
	public Comparator<? super K> comparator() {
		return theCompare;
	}

	/** @return The number of entries in this map */
	public int size() {
		return theSize;
	}

	/** @return Whether this map has no entries */
	public boolean isEmpty() {
		return theSize == 0;
	}

	/**
	 * @param key The key to look up
	 * @return The value stored for the key, or null if the key is not present
	 */
	public V get(K key) {
		AvlNode<K, V> node = theTree.find(key, theCompare);
		return node == null ? null : node.getValue();
	}

	/**
	 * @param key The key to look up
	 * @param defaultValue The value to return if the key is not present
	 * @return The value stored for the key (which may be null), or <code>defaultValue</code> if the key is not present
	 */
	public V getOrDefault(K key, V defaultValue) {
		AvlNode<K, V> node = theTree.find(key, theCompare);
		return node == null ? defaultValue : node.getValue();
	}

	/**
	 * @param key The key to look up
	 * @return Whether an entry is stored for the key
	 */
	public boolean has(K key) {
		return theTree.find(key, theCompare) != null;
	}

	/**
	 * Inserts an entry or replaces the value of an existing one
	 *
	 * @param key The key to set
	 * @param value The value for the key
	 * @return This map
	 */
	public OrderedMap<K, V> set(K key, V value) {
		if (theTree.insert(key, value, theCompare))
			theSize++;
		return this;
	}

	/**
	 * @param key The key to remove
	 * @return Whether an entry was stored for the key and has been removed
	 */
	public boolean delete(K key) {
		if (!theTree.delete(key, theCompare))
			return false;
		theSize--;
		return true;
	}

	/** Removes all entries from this map */
	public void clear() {
		theTree.clear();
		theSize = 0;
	}

	/** @return The keys in this map, in order */
	public Iterable<K> keys() {
		return () -> new InOrderIterator<>(theTree.getRoot(), AvlNode::getKey);
	}

	/** @return The values in this map, in the order of their keys */
	public Iterable<V> values() {
		return () -> new InOrderIterator<>(theTree.getRoot(), AvlNode::getValue);
	}

	/** @return The entries in this map, in order */
	public Iterable<Map.Entry<K, V>> entries() {
		return this;
	}

	@Override
	public Iterator<Map.Entry<K, V>> iterator() {
		return new InOrderIterator<>(theTree.getRoot(), node -> new SimpleMapEntry<>(node.getKey(), node.getValue()));
	}

	/**
	 * Invokes the callback on every entry in order
	 *
	 * @param callback The callback to invoke
	 */
	public void forEach(EntryCallback<? super K, ? super V> callback) {
		for (Map.Entry<K, V> entry : this)
			callback.accept(entry.getValue(), entry.getKey(), this);
	}

	/** @return An independent copy of this map, using the same comparator */
	public OrderedMap<K, V> copy() {
		return new OrderedMap<>(theCompare, theTree.copy(), theSize);
	}

	/** @return The tree structure backing this map */
	AvlTree<K, V> getTree() {
		return theTree;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder().append('{');
		boolean first = true;
		for (Map.Entry<K, V> entry : this) {
			if (first)
				first = false;
			else
				str.append(", ");
			str.append(entry);
		}
		return str.append('}').toString();
	}
}
