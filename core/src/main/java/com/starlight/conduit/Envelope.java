// Copyright (c) 2010 Rob Eden.
// All rights reserved.
//
// Redistribution and use in source and binary forms, with or without
// modification, are permitted provided that the following conditions are met:
//     * Redistributions of source code must retain the above copyright
//       notice, this list of conditions and the following disclaimer.
//     * Redistributions in binary form must reproduce the above copyright
//       notice, this list of conditions and the following disclaimer in the
//       documentation and/or other materials provided with the distribution.
//     * Neither the name of Conduit nor the
//       names of its contributors may be used to endorse or promote products
//       derived from this software without specific prior written permission.
//
// THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
// ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
// WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
// DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
// DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
// (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
// LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
// ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
// (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
// SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.

package com.starlight.conduit;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import static java.util.Objects.requireNonNull;


/**
 * An ordered sequence of opaque byte parts which is exchanged atomically as one
 * logical message. Parts may be pushed and popped at either end, which is how routing
 * and protocol headers are stacked onto (and stripped from) a payload.
 * <p>
 * Envelopes are mutable and not thread safe. Ownership passes with the envelope: once
 * handed to a socket or queue, the sender must not touch it again.
 */
public final class Envelope implements Iterable<byte[]> {
	private final Deque<byte[]> parts;


	public Envelope() {
		parts = new ArrayDeque<>();
	}

	private Envelope( Deque<byte[]> parts ) {
		this.parts = parts;
	}


	/**
	 * Create an envelope containing the given parts, in order.
	 */
	public static Envelope of( @Nonnull byte[]... parts ) {
		Envelope envelope = new Envelope();
		for( byte[] part : parts ) {
			envelope.pushBack( part );
		}
		return envelope;
	}


	public Envelope pushFront( @Nonnull byte[] part ) {
		parts.addFirst( requireNonNull( part ) );
		return this;
	}

	public Envelope pushBack( @Nonnull byte[] part ) {
		parts.addLast( requireNonNull( part ) );
		return this;
	}


	/**
	 * Remove and return the first part.
	 *
	 * @throws NoSuchElementException	If the envelope is empty.
	 */
	public byte[] popFront() {
		return parts.removeFirst();
	}

	/**
	 * Remove and return the last part.
	 *
	 * @throws NoSuchElementException	If the envelope is empty.
	 */
	public byte[] popBack() {
		return parts.removeLast();
	}

	/**
	 * Return the first part without removing it, or null if the envelope is empty.
	 */
	public byte[] peekFront() {
		return parts.peekFirst();
	}


	/**
	 * Return the part at the given index (zero being the front).
	 */
	public byte[] get( int index ) {
		if ( index < 0 || index >= parts.size() ) {
			throw new IndexOutOfBoundsException(
				"Index " + index + " out of range for " + parts.size() + " parts" );
		}

		Iterator<byte[]> it = parts.iterator();
		for( int i = 0; i < index; i++ ) {
			it.next();
		}
		return it.next();
	}


	public int size() {
		return parts.size();
	}

	public boolean isEmpty() {
		return parts.isEmpty();
	}


	/**
	 * Total number of payload bytes in all parts.
	 */
	public long byteCount() {
		long total = 0;
		for( byte[] part : parts ) {
			total += part.length;
		}
		return total;
	}


	/**
	 * An unmodifiable snapshot of the parts, front first. The arrays themselves are
	 * shared with the envelope.
	 */
	public List<byte[]> parts() {
		return Collections.unmodifiableList( new ArrayList<>( parts ) );
	}


	/**
	 * Shallow copy: the part list is copied, the part arrays are shared.
	 */
	public Envelope copy() {
		return new Envelope( new ArrayDeque<>( parts ) );
	}


	@Override
	public Iterator<byte[]> iterator() {
		return Collections.unmodifiableCollection( parts ).iterator();
	}


	@Override
	public String toString() {
		StringBuilder buf = new StringBuilder( "Envelope[" );
		boolean first = true;
		for( byte[] part : parts ) {
			if ( first ) first = false;
			else buf.append( ", " );

			buf.append( part.length );
		}
		return buf.append( "]" ).toString();
	}
}
