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
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InvalidObjectException;


/**
 * Encodes a single argument or return value to its own envelope part, based on the
 * declared type. Primitives are written in fixed-width big-endian form, {@code void}
 * produces an empty part and everything else is Java-serialized through the reference
 * streams (so proxies and exported instances travel as references).
 */
abstract class ValueCodec {
	private static final byte[] EMPTY = new byte[ 0 ];

	static final ValueCodec VOID = new ValueCodec() {
		@Override
		byte[] encode( Object value, RoleContext context ) {
			return EMPTY;
		}

		@Override
		Object decode( byte[] frame, RoleContext context ) {
			return null;
		}
	};


	static ValueCodec forType( @Nonnull Class<?> declared_type ) {
		if ( declared_type == void.class ) return VOID;
		if ( declared_type.isPrimitive() ) return new PrimitiveCodec( declared_type );
		return new ObjectCodec( declared_type );
	}


	abstract byte[] encode( Object value, @Nonnull RoleContext context )
		throws IOException;

	abstract Object decode( @Nonnull byte[] frame, @Nonnull RoleContext context )
		throws IOException, ClassNotFoundException;



	private static class PrimitiveCodec extends ValueCodec {
		private final Class<?> type;

		PrimitiveCodec( Class<?> type ) {
			this.type = type;
		}


		@Override
		byte[] encode( Object value, @Nonnull RoleContext context ) throws IOException {
			if ( value == null ) {
				throw new InvalidObjectException( "Null value for primitive " + type );
			}

			ByteArrayOutputStream bytes = new ByteArrayOutputStream( 8 );
			DataOutputStream out = new DataOutputStream( bytes );

			if ( type == int.class ) out.writeInt( ( ( Integer ) value ).intValue() );
			else if ( type == long.class ) out.writeLong( ( ( Long ) value ).longValue() );
			else if ( type == boolean.class ) {
				out.writeBoolean( ( ( Boolean ) value ).booleanValue() );
			}
			else if ( type == double.class ) {
				out.writeDouble( ( ( Double ) value ).doubleValue() );
			}
			else if ( type == float.class ) {
				out.writeFloat( ( ( Float ) value ).floatValue() );
			}
			else if ( type == short.class ) out.writeShort( ( ( Short ) value ).shortValue() );
			else if ( type == byte.class ) out.writeByte( ( ( Byte ) value ).byteValue() );
			else if ( type == char.class ) {
				out.writeChar( ( ( Character ) value ).charValue() );
			}
			else throw new AssertionError( "Unhandled primitive: " + type );

			out.flush();
			return bytes.toByteArray();
		}


		@Override
		Object decode( @Nonnull byte[] frame, @Nonnull RoleContext context )
			throws IOException {

			DataInputStream in = new DataInputStream( new ByteArrayInputStream( frame ) );

			Object value;
			if ( type == int.class ) value = Integer.valueOf( in.readInt() );
			else if ( type == long.class ) value = Long.valueOf( in.readLong() );
			else if ( type == boolean.class ) value = Boolean.valueOf( in.readBoolean() );
			else if ( type == double.class ) value = Double.valueOf( in.readDouble() );
			else if ( type == float.class ) value = Float.valueOf( in.readFloat() );
			else if ( type == short.class ) value = Short.valueOf( in.readShort() );
			else if ( type == byte.class ) value = Byte.valueOf( in.readByte() );
			else if ( type == char.class ) value = Character.valueOf( in.readChar() );
			else throw new AssertionError( "Unhandled primitive: " + type );

			if ( in.available() != 0 ) {
				throw new InvalidObjectException( "Trailing data after " + type +
					" value: " + in.available() + " bytes" );
			}
			return value;
		}
	}


	private static class ObjectCodec extends ValueCodec {
		private final Class<?> type;

		ObjectCodec( Class<?> type ) {
			this.type = type;
		}


		@Override
		byte[] encode( Object value, @Nonnull RoleContext context ) throws IOException {
			if ( value != null && !type.isInstance( value ) ) {
				throw new InvalidObjectException( "Value of type " +
					value.getClass().getName() + " is not a " + type.getName() );
			}

			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			try( ReferenceObjectOutputStream out =
				new ReferenceObjectOutputStream( bytes, context ) ) {

				out.writeObject( value );
			}
			return bytes.toByteArray();
		}


		@Override
		Object decode( @Nonnull byte[] frame, @Nonnull RoleContext context )
			throws IOException, ClassNotFoundException {

			Object value;
			try( ReferenceObjectInputStream in = new ReferenceObjectInputStream(
				new ByteArrayInputStream( frame ), context ) ) {

				value = in.readObject();
			}

			if ( value != null && !type.isInstance( value ) ) {
				throw new InvalidObjectException( "Value of type " +
					value.getClass().getName() + " is not a " + type.getName() );
			}
			return value;
		}
	}
}
