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

package com.starlight.conduit.exception;

/**
 * Reasons a server could not dispatch a call. These travel on the wire as their
 * {@link #getCode() code}.
 */
public enum DispatchReason {
	/** The qualified function name is not registered on the server. */
	UNKNOWN_FUNCTION( 1 ),
	/** The target (or a referenced) object ID is not in the object registry. */
	UNKNOWN_OBJECT( 2 ),
	/** No exported type is registered under the requested type name. */
	UNKNOWN_TYPE( 3 ),
	/** The type is registered but can't be constructed on the server. */
	NOT_INITIALIZED( 4 ),
	/** The server's request queue was full. */
	OVERLOADED( 5 ),
	/** The request could not be decoded. */
	MALFORMED( 6 );


	private final byte code;

	DispatchReason( int code ) {
		this.code = ( byte ) code;
	}


	public byte getCode() {
		return code;
	}


	public static DispatchReason forCode( byte code ) {
		for( DispatchReason reason : values() ) {
			if ( reason.code == code ) return reason;
		}
		return MALFORMED;
	}
}
