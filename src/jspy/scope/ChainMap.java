package jspy.scope;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One link of a chain of scopes. Writes go to this link only; reads fall through to the enclosing links.
 *
 * @param <K> The key type
 * @param <V> The value type
 */
public class ChainMap<K, V> {
	private final ChainMap<K, V> parent;
	private final Map<K, V> members = new LinkedHashMap<>();

	public ChainMap(ChainMap<K, V> parent) {
		this.parent = parent;
	}

	/**
	 * @return the enclosing link, or null for the root
	 */
	public ChainMap<K, V> getParent() {
		return parent;
	}

	public V put(K key, V value) {
		return members.put(key, value);
	}

	public V get(K key) {
		for (ChainMap<K, V> link = this; link != null; link = link.parent) {
			if (link.members.containsKey(key)) {
				return link.members.get(key);
			}
		}
		return null;
	}

	public boolean containsKey(K key) {
		return hopsTo(key) >= 0;
	}

	/**
	 * @return how many links outward the innermost binding of key lives, or -1 if no link binds it
	 */
	public int hopsTo(K key) {
		int hops = 0;
		for (ChainMap<K, V> link = this; link != null; link = link.parent) {
			if (link.members.containsKey(key)) {
				return hops;
			}
			hops++;
		}
		return -1;
	}
}
