package org.metricshub.aiawk.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * AiAwk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * An AWK associative array.
 * <p>
 * Subscripts are strings (numeric subscripts are converted by the caller,
 * so that <code>a[1]</code> and <code>a["1"]</code> denote the same
 * element). Reading an element that does not exist creates it, through
 * {@link #ensure(String)}, which both the read and the write paths use.
 * Only {@link #isIn(String)} and {@link #remove(String)} look at the
 * array without creating anything.
 * <p>
 * Keys are kept in insertion order, or sorted (numbers first, in numeric
 * order, then strings) when requested.
 *
 * @author Danny Daglas
 */
public class AssocArray {

	private final Map<String, AwkValue> map;

	/**
	 * Creates an array keeping its keys in insertion order.
	 */
	public AssocArray() {
		this(false);
	}

	/**
	 * @param sortedArrayKeys Whether keys must be kept sorted
	 */
	public AssocArray(boolean sortedArrayKeys) {
		if (sortedArrayKeys) {
			map = new TreeMap<String, AwkValue>(KEY_ORDER);
		} else {
			map = new LinkedHashMap<String, AwkValue>();
		}
	}

	/**
	 * Numeric keys first, in numeric order, then the other keys in
	 * lexicographic order.
	 */
	private static final Comparator<String> KEY_ORDER = new Comparator<String>() {
		@Override
		public int compare(String o1, String o2) {
			boolean n1 = AwkValue.looksNumeric(o1);
			boolean n2 = AwkValue.looksNumeric(o2);
			if (n1 && n2) {
				int c = Double.compare(Double.parseDouble(o1.trim()), Double.parseDouble(o2.trim()));
				return c != 0 ? c : o1.compareTo(o2);
			}
			if (n1) {
				return -1;
			}
			if (n2) {
				return 1;
			}
			return o1.compareTo(o2);
		}
	};

	/**
	 * Returns the element with the specified subscript, creating it as
	 * an uninitialized value when it does not exist yet.
	 *
	 * @param key subscript
	 * @return the element value
	 */
	public AwkValue ensure(String key) {
		AwkValue value = map.get(key);
		if (value == null) {
			value = AwkValue.UNINITIALIZED;
			map.put(key, value);
		}
		return value;
	}

	/**
	 * Reads an element. Like in AWK, a reference to a missing element
	 * creates it.
	 *
	 * @param key subscript
	 * @return the element value
	 */
	public AwkValue get(String key) {
		return ensure(key);
	}

	/**
	 * Assigns an element.
	 *
	 * @param key subscript
	 * @param value new value
	 * @return the assigned value
	 */
	public AwkValue put(String key, AwkValue value) {
		ensure(key);
		map.put(key, value);
		return value;
	}

	/**
	 * @param key subscript
	 * @return whether the element exists; never creates it
	 */
	public boolean isIn(String key) {
		return map.containsKey(key);
	}

	/**
	 * Deletes an element, if present.
	 *
	 * @param key subscript
	 */
	public void remove(String key) {
		map.remove(key);
	}

	/**
	 * Deletes all elements.
	 */
	public void clear() {
		map.clear();
	}

	/**
	 * @return the number of elements
	 */
	public int size() {
		return map.size();
	}

	/**
	 * Snapshot of the subscripts, safe to iterate while the array is
	 * modified (as <code>for (k in a)</code> requires).
	 *
	 * @return the subscripts
	 */
	public List<String> keySet() {
		return new ArrayList<String>(map.keySet());
	}

	/**
	 * Replaces the contents with the element values in ascending order,
	 * under subscripts 1 to n. Numeric values sort first, numerically,
	 * then the other values as strings.
	 *
	 * @param convfmt format used to turn numbers into strings
	 * @param locale locale for number formatting
	 * @return the number of elements
	 */
	public int sortValues(final String convfmt, final Locale locale) {
		List<AwkValue> values = new ArrayList<AwkValue>(map.values());
		Collections.sort(values, new Comparator<AwkValue>() {
			@Override
			public int compare(AwkValue o1, AwkValue o2) {
				boolean n1 = o1.isNumeric();
				boolean n2 = o2.isNumeric();
				if (n1 && n2) {
					return Double.compare(o1.toNumber(), o2.toNumber());
				}
				if (n1 != n2) {
					return n1 ? -1 : 1;
				}
				return o1.toString(convfmt, locale).compareTo(o2.toString(convfmt, locale));
			}
		});
		renumber(values);
		return values.size();
	}

	/**
	 * Replaces the contents with the subscripts in ascending order, stored
	 * as string values under subscripts 1 to n.
	 *
	 * @return the number of elements
	 */
	public int sortKeys() {
		List<String> keys = new ArrayList<String>(map.keySet());
		Collections.sort(keys, KEY_ORDER);
		List<AwkValue> values = new ArrayList<AwkValue>(keys.size());
		for (String key : keys) {
			values.add(AwkValue.of(key));
		}
		renumber(values);
		return values.size();
	}

	private void renumber(List<AwkValue> values) {
		map.clear();
		for (int i = 0; i < values.size(); i++) {
			map.put(String.valueOf(i + 1), values.get(i));
		}
	}

	/**
	 * An array cannot be used where a scalar is expected.
	 *
	 * @throws AwkTypeException always
	 */
	@Override
	public String toString() {
		throw new AwkTypeException("Cannot evaluate an unindexed array.");
	}
}
