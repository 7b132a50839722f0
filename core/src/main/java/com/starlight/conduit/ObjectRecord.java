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

import com.starlight.conduit.driver.RoutingIdentity;

import javax.annotation.Nullable;


/**
 * Entry in an {@link ObjectRegistry}.
 */
public final class ObjectRecord {
	private final int object_id;
	private final ExportedType<?> type;
	private final Object instance;
	private final RoutingIdentity owner;


	ObjectRecord( int object_id, ExportedType<?> type, Object instance,
		@Nullable RoutingIdentity owner ) {

		this.object_id = object_id;
		this.type = type;
		this.instance = instance;
		this.owner = owner;
	}


	public int getObjectID() {
		return object_id;
	}

	public ExportedType<?> getType() {
		return type;
	}

	public Object getInstance() {
		return instance;
	}

	/**
	 * The peer that created (or was handed) the object, if known. Objects are destroyed
	 * when their owner disconnects.
	 */
	@Nullable
	public RoutingIdentity getOwner() {
		return owner;
	}


	@Override
	public String toString() {
		return "ObjectRecord{" +
			"object_id=" + object_id +
			", type=" + type.getName() +
			", owner=" + owner +
			'}';
	}
}
