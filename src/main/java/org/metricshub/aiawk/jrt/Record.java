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
import java.util.List;
import java.util.Locale;

/**
 * The current input record and its fields.
 * <p>
 * The record and the field list are kept consistent in both directions:
 * <ul>
 * <li>setting the record ({@link #setRecord(String)} or field 0) re-splits
 * the fields with the field separator in effect;</li>
 * <li>setting field <em>i</em> or NF rebuilds the record by joining the
 * fields with OFS.</li>
 * </ul>
 * Splitting is lazy: it happens on the first access to a field or to NF.
 * A new field separator only applies from the next record on: the
 * separator in effect is captured whenever a new record is set.
 */
public class Record {

	private final RegexCache regexCache;

	private String text = "";
	private List<AwkValue> fields;

	private String fieldSeparator = " ";
	private String activeFieldSeparator = " ";
	private String outputFieldSeparator = " ";
	private boolean paragraphMode;

	private String convfmt = AwkValue.DEFAULT_CONVFMT;
	private Locale locale = Locale.US;

	/**
	 * @param regexCache cache used to compile regular expression separators
	 */
	public Record(RegexCache regexCache) {
		this.regexCache = regexCache;
		this.fields = new ArrayList<AwkValue>();
	}

	/**
	 * Replaces the record. Fields are re-split with the current field
	 * separator.
	 *
	 * @param raw new record text
	 */
	public void setRecord(String raw) {
		text = raw;
		activeFieldSeparator = fieldSeparator;
		fields = null;
	}

	/**
	 * @return the whole record text
	 */
	public String getText() {
		return text;
	}

	/**
	 * Reads a field. Field 0 is the whole record; fields past NF read as
	 * the empty string without creating anything.
	 *
	 * @param index field number
	 * @return the field value
	 * @throws AwkRuntimeException when the index is negative
	 */
	public AwkValue getField(int index) {
		checkIndex(index);
		if (index == 0) {
			return AwkValue.fromInput(text);
		}
		splitIfNeeded();
		if (index > fields.size()) {
			return AwkValue.UNINITIALIZED;
		}
		return fields.get(index - 1);
	}

	/**
	 * Assigns a field. Field 0 replaces the record; other fields extend NF
	 * when needed (padding with empty fields) and rebuild the record.
	 *
	 * @param index field number
	 * @param value new value
	 * @throws AwkRuntimeException when the index is negative
	 */
	public void setField(int index, AwkValue value) {
		checkIndex(index);
		if (index == 0) {
			setRecord(toText(value));
			return;
		}
		splitIfNeeded();
		while (fields.size() < index) {
			fields.add(AwkValue.EMPTY);
		}
		fields.set(index - 1, value);
		rebuild();
	}

	/**
	 * @return the number of fields
	 */
	public int getNF() {
		splitIfNeeded();
		return fields.size();
	}

	/**
	 * Truncates or pads the field list, then rebuilds the record.
	 *
	 * @param nf new number of fields
	 * @throws AwkRuntimeException when NF is negative
	 */
	public void setNF(int nf) {
		if (nf < 0) {
			throw new AwkRuntimeException("NF set to negative value: " + nf);
		}
		splitIfNeeded();
		while (fields.size() > nf) {
			fields.remove(fields.size() - 1);
		}
		while (fields.size() < nf) {
			fields.add(AwkValue.EMPTY);
		}
		rebuild();
	}

	/**
	 * Sets FS. The new separator is used from the next record on.
	 *
	 * @param fs new field separator
	 */
	public void setFieldSeparator(String fs) {
		this.fieldSeparator = fs;
	}

	/**
	 * @return the value of FS
	 */
	public String getFieldSeparator() {
		return fieldSeparator;
	}

	/**
	 * @param ofs the separator used to rebuild the record
	 */
	public void setOutputFieldSeparator(String ofs) {
		this.outputFieldSeparator = ofs;
	}

	/**
	 * @param paragraphMode whether records are paragraphs (RS is empty), in
	 *        which case newlines always separate fields
	 */
	public void setParagraphMode(boolean paragraphMode) {
		this.paragraphMode = paragraphMode;
	}

	/**
	 * Conversion settings used when a numeric field is joined into the
	 * record.
	 *
	 * @param convfmtParam CONVFMT
	 * @param localeParam locale
	 */
	public void setConversion(String convfmtParam, Locale localeParam) {
		this.convfmt = convfmtParam;
		this.locale = localeParam;
	}

	private void splitIfNeeded() {
		if (fields != null) {
			return;
		}
		List<String> parts = FieldSplitter.split(text, activeFieldSeparator, paragraphMode, regexCache);
		fields = new ArrayList<AwkValue>(parts.size());
		for (String part : parts) {
			fields.add(AwkValue.fromInput(part));
		}
	}

	private void rebuild() {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < fields.size(); i++) {
			if (i > 0) {
				sb.append(outputFieldSeparator);
			}
			sb.append(toText(fields.get(i)));
		}
		text = sb.toString();
	}

	private String toText(AwkValue value) {
		return value.toString(convfmt, locale);
	}

	private static void checkIndex(int index) {
		if (index < 0) {
			throw new AwkRuntimeException("Field $(" + index + ") is not allowed");
		}
	}
}
