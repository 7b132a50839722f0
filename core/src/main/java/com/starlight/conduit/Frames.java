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
import java.nio.charset.StandardCharsets;


/**
 * Encoding for the fixed-layout header parts of an envelope: big-endian 32-bit
 * integers and UTF-8 strings.
 */
public final class Frames {
	public static final int INT_FRAME_SIZE = 4;


	// Hidden constructor
	private Frames() {}


	public static byte[] intFrame( int value ) {
		return new byte[] {
			( byte ) ( value >>> 24 ),
			( byte ) ( value >>> 16 ),
			( byte ) ( value >>> 8 ),
			( byte ) value };
	}

	public static int readInt( @Nonnull byte[] frame ) {
		if ( frame.length != INT_FRAME_SIZE ) {
			throw new IllegalArgumentException(
				"Integer frame must be " + INT_FRAME_SIZE + " bytes: " + frame.length );
		}

		return ( ( frame[ 0 ] & 0xff ) << 24 ) |
			( ( frame[ 1 ] & 0xff ) << 16 ) |
			( ( frame[ 2 ] & 0xff ) << 8 ) |
			( frame[ 3 ] & 0xff );
	}


	public static byte[] stringFrame( @Nonnull String value ) {
		return value.getBytes( StandardCharsets.UTF_8 );
	}

	public static String readString( @Nonnull byte[] frame ) {
		return new String( frame, StandardCharsets.UTF_8 );
	}
}
