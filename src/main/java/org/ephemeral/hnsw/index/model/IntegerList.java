package org.ephemeral.hnsw.index.model;

import java.util.Arrays;

/**
 * A dynamic array implementation for integers that automatically grows when capacity is exceeded.
 *
 * <p>Used for per-layer adjacency of {@link HNSWNode}s and for the arena free list. Adjacency lists
 * hold at most M + 1 entries, so linear {@link #contains(int)} and {@link #removeValue(int)} are
 * cheaper than a boxed hash set.
 */
public class IntegerList {

    private static final int INITIAL_CAPACITY = 4;
    private static final int GROWTH_FACTOR = 2;
    private int[] array;
    private int size;

    /**
     * Creates an empty list with default initial capacity of 4.
     */
    public IntegerList() {
        this(INITIAL_CAPACITY);
    }

    /**
     * Creates an empty list with specified initial capacity.
     *
     * @param capacity initial capacity of the list
     */
    public IntegerList(int capacity) {
        array = new int[Math.max(capacity, 1)];
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Returns the element at the specified index.
     *
     * @param index the index of the element to return
     * @return the element at the specified index
     * @throws IllegalArgumentException if index is out of bounds
     */
    public int get(int index) {
        checkBounds(index);
        return array[index];
    }

    /**
     * Appends the specified element to the end of this list.
     *
     * @param element the element to be appended
     */
    public void add(int element) {
        if (size == array.length) {
            grow(array.length * GROWTH_FACTOR);
        }
        array[size] = element;
        size++;
    }

    /**
     * Appends the element unless it is already present.
     *
     * @return true if the element was appended
     */
    public boolean addIfAbsent(int element) {
        if (contains(element)) {
            return false;
        }
        add(element);
        return true;
    }

    public boolean contains(int element) {
        return indexOf(element) >= 0;
    }

    public int indexOf(int element) {
        for (int i = 0; i < size; i++) {
            if (array[i] == element) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes the first occurrence of the element. Order of the remaining elements is preserved.
     *
     * @return true if the element was present
     */
    public boolean removeValue(int element) {
        int index = indexOf(element);
        if (index < 0) {
            return false;
        }
        System.arraycopy(array, index + 1, array, index, size - index - 1);
        size--;
        return true;
    }

    /**
     * Removes and returns the last element.
     *
     * @throws IllegalArgumentException if the list is empty
     */
    public int removeLast() {
        checkBounds(size - 1);
        size--;
        return array[size];
    }

    public void clear() {
        size = 0;
    }

    public int[] toArray() {
        return Arrays.copyOf(array, size);
    }

    /**
     * Increases the capacity of the internal array to accommodate more elements.
     *
     * @param newCapacity the new capacity of the array
     */
    private void grow(int newCapacity) {
        int[] newArray = new int[newCapacity];
        System.arraycopy(array, 0, newArray, 0, size);
        array = newArray;
    }

    private void checkBounds(int index) {
        if (index < 0 || index >= size) {
            throw new IllegalArgumentException("Index : " + index + " is less than 0 or it is greater than size of " +
                    "list " + size);
        }
    }

    @Override
    public String toString() {
        return Arrays.toString(toArray());
    }
}
