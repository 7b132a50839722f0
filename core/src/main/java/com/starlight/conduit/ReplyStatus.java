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

/**
 * Status part of a reply envelope.
 */
enum ReplyStatus {
	/** Payload is the encoded return value. */
	OK( 0 ),
	/** Payload is the serialized throwable raised by the implementation. */
	THROWN( 1 ),
	/** Payload is a reason code and detail message. */
	DISPATCH_ERROR( 2 );


	private final byte code;
	private final byte[] frame;

	ReplyStatus( int code ) {
		this.code = ( byte ) code;
		this.frame = new byte[] { this.code };
	}


	byte getCode() {
		return code;
	}

	byte[] frame() {
		return frame.clone();
	}


	static ReplyStatus forFrame( byte[] frame ) {
		if ( frame.length != 1 ) {
			throw new IllegalArgumentException( "Invalid status frame length: " +
				frame.length );
		}
		for( ReplyStatus status : values() ) {
			if ( status.code == frame[ 0 ] ) return status;
		}
		throw new IllegalArgumentException( "Unknown status: " + frame[ 0 ] );
	}
}
