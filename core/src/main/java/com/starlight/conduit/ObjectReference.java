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

import java.io.Serializable;


/**
 * Serialized stand-in for an exported object: its server-side ID, the name of its
 * exported type and whether the object belongs to the peer receiving the reference. Written in place of live objects by
 * {@link ReferenceObjectOutputStream} and turned back into an instance (server) or a
 * proxy (client) by {@link ReferenceObjectInputStream}.
 */
final class ObjectReference implements Serializable {
	private static final long serialVersionUID = 0L;

	private final int object_id;
	private final String type_name;
	private final boolean owned;


	ObjectReference( int object_id, String type_name, boolean owned ) {
		this.object_id = object_id;
		this.type_name = type_name;
		this.owned = owned;
	}


	int getObjectID() {
		return object_id;
	}

	String getTypeName() {
		return type_name;
	}

	/**
	 * True if the server attributes the object to the receiving peer, which is then
	 * responsible for releasing it.
	 */
	boolean isOwned() {
		return owned;
	}


	@Override
	public boolean equals( Object o ) {
		if ( this == o ) return true;
		if ( o == null || getClass() != o.getClass() ) return false;

		ObjectReference that = ( ObjectReference ) o;
		return object_id == that.object_id && type_name.equals( that.type_name );
	}

	@Override
	public int hashCode() {
		return 31 * object_id + type_name.hashCode();
	}

	@Override
	public String toString() {
		return "ObjectReference(" + type_name + "@" + object_id + ")";
	}
}
